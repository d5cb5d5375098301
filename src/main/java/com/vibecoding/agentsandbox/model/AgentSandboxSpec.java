package com.vibecoding.agentsandbox.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.fabric8.kubernetes.api.model.LocalObjectReference;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.List;

/**
 * 클레임 spec (사용자 입력)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSandboxSpec {
    private String image;                       // 에이전트 이미지 (필수)
    private List<String> command;
    private List<String> args;
    private String size;                        // micro, small, medium, large
    private NatsBinding nats;                   // 스케일링 신호 (stream, consumer 필수)

    private Integer httpPort;                   // 설정 시에만 Service 생성
    private String healthPath;
    private String readyPath;
    private String sessionAffinity;             // None, ClientIP

    private String secret1Name;
    private String secret2Name;
    private String secret3Name;
    private String secret4Name;
    private String secret5Name;
    private String platformSecretName;          // 비어 있으면 컨트롤러 기본값

    @JsonProperty("storageGB")
    private Integer storageGB;
    private List<LocalObjectReference> imagePullSecrets;
    private InitContainerOverride initContainer;

    /**
     * secret1Name..secret5Name 순서의 사용자 Secret 슬롯 (미설정 슬롯은 null)
     */
    @JsonIgnore
    public List<String> userSecretSlots() {
        return Arrays.asList(secret1Name, secret2Name, secret3Name, secret4Name, secret5Name);
    }
}

package com.vibecoding.agentsandbox.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 워크스페이스 복원 이후 실행되는 사용자 init 컨테이너
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InitContainerOverride {
    private String image;           // 비어 있으면 메인 이미지 사용
    private List<String> command;
    private List<String> args;
}

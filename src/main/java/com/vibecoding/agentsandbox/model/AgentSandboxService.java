package com.vibecoding.agentsandbox.model;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * 에이전트 샌드박스 클레임 (AgentSandboxService)
 */
@Group(AgentSandboxService.GROUP)
@Version(AgentSandboxService.VERSION)
@Kind(AgentSandboxService.KIND)
@Plural("agentsandboxservices")
public class AgentSandboxService extends CustomResource<AgentSandboxSpec, AgentSandboxStatus> implements Namespaced {

    public static final String GROUP = "platform.bizmatters.io";
    public static final String VERSION = "v1alpha1";
    public static final String KIND = "AgentSandboxService";
    public static final String API_VERSION = GROUP + "/" + VERSION;

    // 게이트웨이가 접근할 때마다 갱신하는 하트비트 (ISO-8601)
    public static final String LAST_ACTIVE_ANNOTATION = GROUP + "/last-active";

    public String key() {
        return getMetadata().getNamespace() + "/" + getMetadata().getName();
    }
}

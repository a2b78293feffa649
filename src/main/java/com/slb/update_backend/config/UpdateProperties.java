package com.slb.update_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.updates")
@Data
public class UpdateProperties {

    /**
     * 应用配置了公钥时，没有签名的 artifact 不会下发给客户端（Tauri 会拒绝无签名更新）。
     */
    private boolean requireSignatureWhenPublicKey = true;
}

package com.lendingvault.engine.domain.service.access;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "vault.access")
public class AccessProperties {

    private List<String> admins = new ArrayList<>();

    private List<String> collateralLiquidators = new ArrayList<>();
}

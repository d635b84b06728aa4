package com.mmbrief.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {
    private int historyYears = 5;
}

package com.mmbrief.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "db")
public class DbProperties {
    private String url = "";
    private String user = "mmbrief";
    private String pass = "";
    private String schema = "mmbrief";
    private String localPath = "market_history.db";
    private boolean strict = false;
    private SqlLog sqlLog = new SqlLog();

    @Getter
    @Setter
    public static class SqlLog {
        private boolean enabled = false;
    }
}

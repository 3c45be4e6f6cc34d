package com.askdb.util;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.util.Map;

@Data
@Builder
public class JdbcConnectionInfo {
    @ToString.Exclude
    private String url;
    @ToString.Exclude
    private String username;
    @ToString.Exclude
    private String password;
    private String dbType;
    @ToString.Exclude
    private String host;
    @ToString.Exclude
    private Map<String, String> properties;
}

package com.askdb.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.ToString;

@Data
public class ConnectionTestRequest {
    @NotBlank(message = "DSN is required")
    @ToString.Exclude
    private String dsn;
}

package me.golemcore.middleware.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchResponse {
    private String result;
    private String source;
    private long elapsedMs;
    private String fault;
    private boolean success;
}

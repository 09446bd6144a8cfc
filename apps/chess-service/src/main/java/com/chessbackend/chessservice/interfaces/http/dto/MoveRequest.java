package com.chessbackend.chessservice.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 走子请求体：{"from":"e2","to":"e4","promotion":"q"}
 */
@Data
@NoArgsConstructor
public class MoveRequest {
    /**
     * 起点，代数记法，如 e2
     */
    @NotBlank(message = "from is required")
    private String from;

    /**
     * 终点，代数记法，如 e4
     */
    @NotBlank(message = "to is required")
    private String to;

    /**
     * 升变编码（可选）：兵到底线时 q/r/b/n 之一，默认 q
     */
    private String promotion;

    public MoveRequest(String from, String to, String promotion) {
        this.from = from;
        this.to = to;
        this.promotion = promotion;
    }
}

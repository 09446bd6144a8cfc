package com.chessbackend.chessservice.interfaces.http;

import com.chessbackend.web.common.ApiResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 健康检查
 */
@RestController
public class HealthController {

    @GetMapping("/")
    public ApiResponse<Map<String, String>> health() {
        return ApiResponse.success(Map.of("message", "Healthy"));
    }
}

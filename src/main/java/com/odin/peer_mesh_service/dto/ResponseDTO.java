package com.odin.peer_mesh_service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ResponseDTO {

	private Integer statusCode;
    private String status;
    private String message;
    private Object data;

    public static ResponseDTO ok(String message, Object data) {
        return ResponseDTO.builder()
                .statusCode(200)
                .status("SUCCESS")
                .message(message)
                .data(data)
                .build();
    }

    public static ResponseDTO failure(int statusCode, String message) {
        return ResponseDTO.builder()
                .statusCode(statusCode)
                .status("FAILURE")
                .message(message)
                .build();
    }
}

package io.github.crudgraph.core.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import static io.github.crudgraph.core.util.TimeUtils.formatExecutionTime;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    private boolean success;
    private String message;
    private Integer statusCode;
    private String status;
    private T data;
    private ErrorDetails error;
    private String timestamp;
    private String executionTime;

    // List operation metadata
    private Pagination pagination;

    public static <T> ApiResponse<T> success(T data, String message, HttpStatus status, long executionTimeMs) {
        return ApiResponse.<T>builder()
                .success(true)
                .message(message)
                .statusCode(status.value())
                .status(status.name())
                .data(data)
                .executionTime(formatExecutionTime(executionTimeMs))
                .timestamp(now())
                .build();
    }

    public static <T> ApiResponse<T> success(T data, String message, long executionTimeMs) {
        return success(data, message, HttpStatus.OK, executionTimeMs);
    }

    public static <T> ApiResponse<T> page(T data, int page, int pageSize, long totalCount, long executionTimeMs) {
        ApiResponse<T> response = success(data, "Items retrieved successfully", executionTimeMs);
        response.setPagination(new Pagination(page, pageSize, totalCount));
        return response;
    }

    public static <T> ApiResponse<T> error(String message, HttpStatus status, String errorCode, String details) {
        return ApiResponse.<T>builder()
                .success(false)
                .message(message)
                .statusCode(status.value())
                .status(status.name())
                .error(ErrorDetails.builder()
                        .code(errorCode)
                        .details(details)
                        .build())
                .timestamp(now())
                .build();
    }

    public static <T> ApiResponse<T> error(String message, HttpStatus status) {
        return error(message, status, status.name(), message);
    }

    private static String now() {
        return LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetails {
        private String code;
        private String details;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pagination {
        private int page;
        private int pageSize;
        private long totalCount;
    }
}

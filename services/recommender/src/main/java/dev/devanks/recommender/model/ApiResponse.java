// services/recommender/src/main/java/dev/devanks/recommender/model/ApiResponse.java
package dev.devanks.recommender.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for every HTTP response: either {@code data} or {@code error} is set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private T data;
    private Error error;

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data, null);
    }

    public static ApiResponse<Void> error(int code, String message) {
        return new ApiResponse<>(null, new Error(code, message));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Error {
        private int code;
        private String message;
    }
}

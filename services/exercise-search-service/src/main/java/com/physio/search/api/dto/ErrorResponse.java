package com.physio.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.physio.search.service.FieldViolation;
import java.util.List;

public class ErrorResponse {
    private boolean success = false;
    private ErrorDetail error;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<FieldViolation> details;

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    public ErrorResponse() {
    }

    public ErrorResponse(String code, String message, String traceId, String requestId) {
        this(code, message, List.of(), traceId, requestId);
    }

    public ErrorResponse(String code, String message, List<FieldViolation> details, String traceId, String requestId) {
        this.error = new ErrorDetail(code, message);
        this.details = details;
        this.traceId = traceId;
        this.requestId = requestId;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public ErrorDetail getError() {
        return error;
    }

    public void setError(ErrorDetail error) {
        this.error = error;
    }

    public List<FieldViolation> getDetails() {
        return details;
    }

    public void setDetails(List<FieldViolation> details) {
        this.details = details;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public static class ErrorDetail {
        private String code;
        private String message;

        public ErrorDetail() {
        }

        public ErrorDetail(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String getCode() {
            return code;
        }

        public void setCode(String code) {
            this.code = code;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }
    }
}

package com.firesql.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Response for a single query: either frames, or an error with its status.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataResponse {

    @JsonProperty("frames")
    private List<Frame> frames;

    @JsonProperty("status")
    private ErrorStatus status;

    @JsonProperty("error")
    private String error;

    @JsonProperty("execution_time_ms")
    private long executionTimeMs;

    /**
     * Default constructor
     */
    public DataResponse() {
        this.frames = new ArrayList<>();
    }

    public static DataResponse of(Frame frame) {
        DataResponse response = new DataResponse();
        response.addFrame(frame);
        return response;
    }

    public static DataResponse error(ErrorStatus status, String message) {
        DataResponse response = new DataResponse();
        response.setStatus(status);
        response.setError(message);
        return response;
    }

    // Getters and Setters

    public List<Frame> getFrames() {
        return frames;
    }

    public void setFrames(List<Frame> frames) {
        this.frames = frames;
    }

    public ErrorStatus getStatus() {
        return status;
    }

    public void setStatus(ErrorStatus status) {
        this.status = status;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public void setExecutionTimeMs(long executionTimeMs) {
        this.executionTimeMs = executionTimeMs;
    }

    public boolean hasError() {
        return error != null;
    }

    public void addFrame(Frame frame) {
        this.frames.add(frame);
    }
}

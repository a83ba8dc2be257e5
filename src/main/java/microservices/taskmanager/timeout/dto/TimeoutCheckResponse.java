package microservices.taskmanager.timeout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class TimeoutCheckResponse {
    private boolean success;
    @JsonProperty("exit_code")
    private int exitCode;
    private String output;
}

package microservices.taskmanager.timeout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class RestRequestResponse {
    private boolean success;
    private String message;
    @JsonProperty("delay_id")
    private String delayId;
    @JsonProperty("rest_max")
    private int restMax;
    @JsonProperty("remaining_rests")
    private int remainingRests;
    @JsonProperty("is_last_time")
    private boolean lastTime;
}

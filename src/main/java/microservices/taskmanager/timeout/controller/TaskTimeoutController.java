package microservices.taskmanager.timeout.controller;

import java.time.Clock;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import microservices.taskmanager.timeout.dto.RestRequest;
import microservices.taskmanager.timeout.dto.RestRequestResponse;
import microservices.taskmanager.timeout.dto.TimeoutCheckResponse;
import microservices.taskmanager.timeout.model.RestGrant;
import microservices.taskmanager.timeout.model.ScanSummary;
import microservices.taskmanager.timeout.service.TaskTimeoutService;

@RestController
@RequestMapping("/admin/tasks")
@Slf4j
public class TaskTimeoutController {

	private final TaskTimeoutService taskTimeoutService;
	private final Clock clock;

	public TaskTimeoutController(TaskTimeoutService taskTimeoutService, Clock clock) {
		this.taskTimeoutService = taskTimeoutService;
		this.clock = clock;
	}

	/**
	 * Runs the same sweep as the scheduler, synchronously.
	 */
	@PostMapping("/check-timeouts")
	public ResponseEntity<TimeoutCheckResponse> checkTimeouts() {
		log.info("Received manual request to check task timeouts");

		ScanSummary summary = taskTimeoutService.checkTaskTimeouts(clock.instant());

		return ResponseEntity.ok(TimeoutCheckResponse.builder()
				.success(summary.isSuccess())
				.exitCode(summary.getExitCode())
				.output(summary.getOutput())
				.build());
	}

	@PostMapping("/{taskId}/rests")
	public ResponseEntity<RestRequestResponse> requestRest(@PathVariable String taskId,
			@Valid @RequestBody RestRequest request) {
		log.info("Received rest request on task {} from user {}", taskId, request.getUserId());

		RestGrant grant = taskTimeoutService.requestRest(taskId, request.getUserId(), clock.instant());

		String message = grant.isLastTime()
				? "LAST TIME: Rest/delay requested successfully. This is your last rest/delay opportunity."
				: "Rest/delay requested successfully.";
		return ResponseEntity.ok(RestRequestResponse.builder()
				.success(true)
				.message(message)
				.delayId(grant.getDelayId())
				.restMax(grant.getRestMax())
				.remainingRests(grant.getRestMax())
				.lastTime(grant.isLastTime())
				.build());
	}

}

package microservices.taskmanager.timeout.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import microservices.taskmanager.timeout.entity.NotificationTimeout;
import microservices.taskmanager.timeout.entity.Task;
import microservices.taskmanager.timeout.entity.UserAccount;
import microservices.taskmanager.timeout.enums.TimeOutMode;
import microservices.taskmanager.timeout.model.ScanSummary;
import microservices.taskmanager.timeout.notifier.PushDeliveryException;
import microservices.taskmanager.timeout.notifier.PushMessage;
import microservices.taskmanager.timeout.notifier.PushNotifier;
import microservices.taskmanager.timeout.repository.DelayRepository;
import microservices.taskmanager.timeout.repository.NotificationTimeoutRepository;
import microservices.taskmanager.timeout.repository.TaskRepository;

@ExtendWith(MockitoExtension.class)
class TimeoutRepeatProcessorTest {

    private static final Instant NOW = Instant.parse("2026-03-11T09:30:00Z");

    @Mock
    private NotificationTimeoutRepository notificationTimeoutRepository;

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private RecipientResolver recipientResolver;

    @Mock
    private DelayRepository delayRepository;

    @Mock
    private PushNotifier pushNotifier;

    private TimeoutRepeatProcessor processor;
    private Task task;
    private UserAccount user;
    private ScanSummary summary;

    @BeforeEach
    void setUp() {
        DeadlineCalculator deadlineCalculator = new DeadlineCalculator(Clock.fixed(NOW, ZoneOffset.UTC), TimeOutMode.TIME_OF_DAY);
        processor = new TimeoutRepeatProcessor(notificationTimeoutRepository, taskRepository, recipientResolver,
                new DelayLedger(delayRepository, Duration.ofMinutes(15)), deadlineCalculator, pushNotifier);

        task = new Task();
        task.setId("task-1");
        task.setName("Inventory");
        task.setStep("pending");
        task.setStatus(true);
        task.setPeriodStart(LocalDate.parse("2026-03-10"));
        task.setPeriodEnd(LocalDate.parse("2026-03-12"));
        task.setPeriodType("daily");
        task.setTimeCloture("17:00");
        task.setTimeOut("08:00");
        task.setRestTime("00:30:00");
        task.setRestMax(3);

        user = new UserAccount();
        user.setId(7L);
        user.setUserName("alice");
        user.setFcmToken("token-7");

        summary = new ScanSummary();
    }

    private NotificationTimeout dueRow(int restMax, int repeatCount) {
        NotificationTimeout row = new NotificationTimeout();
        row.setId("nt-1");
        row.setTaskId("task-1");
        row.setUsersId(7L);
        row.setNext(NOW);
        row.setRestMax(restMax);
        row.setRepeatCount(repeatCount);
        when(notificationTimeoutRepository.findByNextLessThanEqual(NOW)).thenReturn(List.of(row));
        return row;
    }

    private void givenReachableTaskAndUser() {
        when(taskRepository.findById("task-1")).thenReturn(Optional.of(task));
        when(recipientResolver.reachableUser(7L)).thenReturn(Optional.of(user));
        when(pushNotifier.isAvailable()).thenReturn(true);
    }

    @Test
    void process_DueRepeat_ShouldSendAndScheduleTheNextOne() throws Exception {
        // Arrange
        NotificationTimeout row = dueRow(3, 0);
        givenReachableTaskAndUser();
        when(pushNotifier.send(any(PushMessage.class))).thenReturn("msg-id");

        // Act
        processor.process(NOW, summary);

        // Assert
        assertEquals(1, summary.getTimeoutRepeats());
        assertEquals(0, summary.getSkipped());
        assertEquals(1, row.getRepeatCount());
        assertNull(row.getNext());

        ArgumentCaptor<PushMessage> message = ArgumentCaptor.forClass(PushMessage.class);
        verify(pushNotifier).send(message.capture());
        assertEquals("Task Timeout Reminder: Inventory", message.getValue().getTitle());
        assertEquals("Reminder: The timeout for task 'Inventory' is active. Time remaining until closure: 7 hours 30 minutes.",
                message.getValue().getBody());
        assertEquals("timeout_repeat", message.getValue().getData().get("notification_type"));
        assertEquals("nt-1", message.getValue().getData().get("notification_timeout_id"));
        assertEquals("1", message.getValue().getData().get("send_number"));

        ArgumentCaptor<NotificationTimeout> saved = ArgumentCaptor.forClass(NotificationTimeout.class);
        verify(notificationTimeoutRepository, times(2)).save(saved.capture());
        NotificationTimeout next = saved.getAllValues().get(1);
        assertNotSame(row, next);
        assertEquals(NOW.plus(Duration.ofMinutes(30)), next.getNext());
        assertEquals(1, next.getRepeatCount());
        assertEquals(3, next.getRestMax());
        assertEquals(7L, next.getUsersId());
        assertEquals(NOW, next.getCreatedAt());
    }

    @Test
    void process_LastRepeat_ShouldWarnAndStopTheChain() throws Exception {
        // Arrange
        NotificationTimeout row = dueRow(2, 1);
        givenReachableTaskAndUser();
        when(pushNotifier.send(any(PushMessage.class))).thenReturn("msg-id");

        // Act
        processor.process(NOW, summary);

        // Assert
        assertEquals(1, summary.getTimeoutRepeats());
        ArgumentCaptor<PushMessage> message = ArgumentCaptor.forClass(PushMessage.class);
        verify(pushNotifier).send(message.capture());
        assertEquals("LAST TIME: Task Timeout Reminder: Inventory", message.getValue().getTitle());
        assertTrue(message.getValue().getBody().endsWith("This is your last timeout reminder."));
        assertEquals("true", message.getValue().getData().get("is_last_time"));
        verify(notificationTimeoutRepository, times(1)).save(row);
        assertEquals(2, row.getRepeatCount());
    }

    @Test
    void process_LaterRepeat_ShouldMentionItsNumber() throws Exception {
        // Arrange
        dueRow(3, 1);
        givenReachableTaskAndUser();
        when(pushNotifier.send(any(PushMessage.class))).thenReturn("msg-id");

        // Act
        processor.process(NOW, summary);

        // Assert
        ArgumentCaptor<PushMessage> message = ArgumentCaptor.forClass(PushMessage.class);
        verify(pushNotifier).send(message.capture());
        assertTrue(message.getValue().getBody().endsWith("This is timeout reminder number 2."));
    }

    @Test
    void process_WhenLimitAlreadyReached_ShouldCloseWithoutSending() throws Exception {
        // Arrange
        NotificationTimeout row = dueRow(2, 2);
        when(taskRepository.findById("task-1")).thenReturn(Optional.of(task));

        // Act
        processor.process(NOW, summary);

        // Assert
        assertEquals(1, summary.getSkipped());
        assertNull(row.getNext());
        verify(notificationTimeoutRepository).save(row);
        verifyNoInteractions(pushNotifier, recipientResolver);
    }

    @Test
    void process_ForInactiveTask_ShouldClose() {
        // Arrange
        NotificationTimeout row = dueRow(3, 0);
        task.setStatus(false);
        when(taskRepository.findById("task-1")).thenReturn(Optional.of(task));

        // Act
        processor.process(NOW, summary);

        // Assert
        assertEquals(1, summary.getSkipped());
        assertNull(row.getNext());
        verify(notificationTimeoutRepository).save(row);
        verifyNoInteractions(pushNotifier);
    }

    @Test
    void process_ForUserWithoutToken_ShouldLeaveRowPending() {
        // Arrange
        NotificationTimeout row = dueRow(3, 0);
        when(taskRepository.findById("task-1")).thenReturn(Optional.of(task));
        when(recipientResolver.reachableUser(7L)).thenReturn(Optional.empty());

        // Act
        processor.process(NOW, summary);

        // Assert
        assertEquals(1, summary.getSkipped());
        assertEquals(NOW, row.getNext());
        assertEquals(0, row.getRepeatCount());
        verify(notificationTimeoutRepository, never()).save(any());
    }

    @Test
    void process_WhileTransportUnavailable_ShouldLeaveRowPending() throws Exception {
        // Arrange
        NotificationTimeout row = dueRow(3, 0);
        when(taskRepository.findById("task-1")).thenReturn(Optional.of(task));
        when(recipientResolver.reachableUser(7L)).thenReturn(Optional.of(user));
        when(pushNotifier.isAvailable()).thenReturn(false);

        // Act
        processor.process(NOW, summary);

        // Assert
        assertEquals(1, summary.getSkipped());
        assertEquals(0, summary.getTimeoutRepeats());
        assertEquals(NOW, row.getNext());
        verify(pushNotifier, never()).send(any());
        verify(notificationTimeoutRepository, never()).save(any());
    }

    @Test
    void process_WhenDeliveryRejected_ShouldCountSkippedAndStillAdvance() throws Exception {
        // Arrange
        NotificationTimeout row = dueRow(3, 0);
        givenReachableTaskAndUser();
        when(pushNotifier.send(any(PushMessage.class))).thenThrow(new PushDeliveryException("unregistered"));

        // Act
        processor.process(NOW, summary);

        // Assert
        assertEquals(0, summary.getTimeoutRepeats());
        assertEquals(1, summary.getSkipped());
        assertEquals(1, row.getRepeatCount());
        verify(notificationTimeoutRepository, times(2)).save(any(NotificationTimeout.class));
    }

    @Test
    void process_WhenDueRowsCannotBeLoaded_ShouldCountOneSkip() {
        // Arrange
        when(notificationTimeoutRepository.findByNextLessThanEqual(NOW)).thenThrow(new IllegalStateException("mongo down"));

        // Act
        assertDoesNotThrow(() -> processor.process(NOW, summary));

        // Assert
        assertEquals(1, summary.getSkipped());
    }

}

package microservices.taskmanager.timeout.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import microservices.taskmanager.timeout.entity.Task;
import microservices.taskmanager.timeout.entity.UserAccount;
import microservices.taskmanager.timeout.repository.UserAccountRepository;
import microservices.taskmanager.timeout.util.AssigneeParser;

/**
 * Looks up the people a task talks to. Only users holding a push token are
 * returned; the controller field may carry an id, a user name or an email.
 */
@Component
@Slf4j
public class RecipientResolver {

    private final AssigneeParser assigneeParser;
    private final UserAccountRepository userAccountRepository;

    public RecipientResolver(AssigneeParser assigneeParser, UserAccountRepository userAccountRepository) {
        this.assigneeParser = assigneeParser;
        this.userAccountRepository = userAccountRepository;
    }

    /**
     * Reachable assignees in assignment order. The creator is always left out,
     * the controller only when asked.
     */
    public List<UserAccount> assignees(Task task, boolean excludeController) {
        List<Long> userIds = new ArrayList<>(assigneeParser.parse(task.getUsers()));
        if (userIds.isEmpty()) {
            log.info("Task {} has no assigned users", task.getId());
            return List.of();
        }

        Set<Long> excluded = new HashSet<>();
        if (task.getCreatedBy() != null) {
            excluded.add(task.getCreatedBy());
        }
        if (excludeController) {
            controllerId(task).ifPresent(excluded::add);
        }
        userIds.removeAll(excluded);
        if (userIds.isEmpty()) {
            log.info("No users to notify for task {} after excluding {}", task.getId(), excluded);
            return List.of();
        }

        Map<Long, UserAccount> byId = userAccountRepository.findByIdIn(userIds).stream()
                .filter(UserAccount::hasPushToken)
                .collect(Collectors.toMap(UserAccount::getId, Function.identity(), (a, b) -> a));
        List<UserAccount> recipients = userIds.stream()
                .map(byId::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        if (recipients.isEmpty()) {
            log.info("No users with push tokens found for task {} among {}", task.getId(), userIds);
        }
        return recipients;
    }

    public Optional<UserAccount> controller(Task task) {
        String controller = trimmedController(task);
        if (controller == null) {
            return Optional.empty();
        }
        Optional<UserAccount> user = isNumeric(controller)
                ? userAccountRepository.findById(Long.parseLong(controller))
                : Optional.empty();
        if (user.isEmpty()) {
            user = userAccountRepository.findFirstByUserNameOrEmail(controller, controller);
        }
        return user.filter(UserAccount::hasPushToken);
    }

    public Optional<UserAccount> reachableUser(Long userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return userAccountRepository.findById(userId).filter(UserAccount::hasPushToken);
    }

    public boolean isAssigned(Task task, Long userId) {
        return userId != null && assigneeParser.parse(task.getUsers()).contains(userId);
    }

    public boolean isController(Task task, UserAccount user) {
        String controller = trimmedController(task);
        if (controller == null || user == null) {
            return false;
        }
        return controller.equals(String.valueOf(user.getId()))
                || controller.equalsIgnoreCase(user.getUserName())
                || controller.equalsIgnoreCase(user.getEmail());
    }

    private Optional<Long> controllerId(Task task) {
        String controller = trimmedController(task);
        if (controller == null) {
            return Optional.empty();
        }
        if (isNumeric(controller)) {
            return Optional.of(Long.parseLong(controller));
        }
        return userAccountRepository.findFirstByUserNameOrEmail(controller, controller).map(UserAccount::getId);
    }

    private static String trimmedController(Task task) {
        String controller = task.getController();
        return controller == null || controller.isBlank() ? null : controller.trim();
    }

    private static boolean isNumeric(String value) {
        return value.length() <= 18 && value.chars().allMatch(Character::isDigit);
    }

}

package microservices.taskmanager.timeout.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns the stored assignee text of a task into user ids. A JSON array such as
 * [2,3] or ["2","3"] is read first; otherwise every integer token is taken.
 * Order is kept and duplicates are dropped.
 */
@Component
@Slf4j
public class AssigneeParser {

    private static final Pattern INTEGER_TOKEN = Pattern.compile("\\d+");

    private final ObjectMapper objectMapper;

    public AssigneeParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Long> parse(String users) {
        if (users == null || users.isBlank()) {
            return List.of();
        }
        Set<Long> ids = new LinkedHashSet<>();
        if (!readJsonArray(users, ids)) {
            Matcher matcher = INTEGER_TOKEN.matcher(users);
            while (matcher.find()) {
                addId(matcher.group(), ids);
            }
        }
        return new ArrayList<>(ids);
    }

    private boolean readJsonArray(String users, Set<Long> ids) {
        JsonNode root;
        try {
            root = objectMapper.readTree(users);
        } catch (JsonProcessingException e) {
            log.debug("Assignee list is not JSON, falling back to token scan: {}", users);
            return false;
        }
        if (root == null || !root.isArray()) {
            return false;
        }
        for (JsonNode node : root) {
            if (node.canConvertToLong()) {
                ids.add(node.asLong());
            } else if (node.isTextual()) {
                addId(node.asText().trim(), ids);
            }
        }
        return true;
    }

    private void addId(String token, Set<Long> ids) {
        try {
            ids.add(Long.parseLong(token));
        } catch (NumberFormatException e) {
            log.debug("Ignoring assignee token {}", token);
        }
    }

}

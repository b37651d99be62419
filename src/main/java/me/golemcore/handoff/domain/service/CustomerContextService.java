/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */
package me.golemcore.handoff.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.handoff.domain.model.ActionItem;
import me.golemcore.handoff.domain.model.Artifact;
import me.golemcore.handoff.domain.model.CustomerEvent;
import me.golemcore.handoff.domain.model.CustomerRecord;
import me.golemcore.handoff.domain.model.Project;
import me.golemcore.handoff.domain.model.TenantContext;
import me.golemcore.handoff.infrastructure.config.HandoffProperties;
import me.golemcore.handoff.port.outbound.CustomerDataPort;
import me.golemcore.handoff.port.outbound.DomainContextPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders the customer workspace as the Markdown context block appended to
 * every agent prompt.
 *
 * <p>
 * The block is kept within {@code handoff.orchestrator.context-char-budget} by
 * progressive truncation: events are cut first, then projects, artifacts and
 * action items.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerContextService implements DomainContextPort {

    static final String UNAVAILABLE = "## Current Customer Context\n\nCustomer data could not be loaded.";

    private static final int MAX_EVENTS = 10;
    private static final int MAX_ARTIFACTS = 10;
    private static final int MAX_ACTION_ITEMS = 10;
    private static final int INACTIVITY_DAYS = 14;
    private static final int PROJECT_DESCRIPTION_EXCERPT = 80;
    private static final String WARNING = "⚠️ ";
    private static final String NOT_SPECIFIED = "Not specified";

    private final CustomerDataPort customerData;
    private final HandoffProperties properties;
    private final Clock clock;

    @Override
    public String buildContext(TenantContext tenant) {
        Optional<CustomerRecord> found;
        try {
            found = customerData.findById(tenant.getCustomerId());
        } catch (RuntimeException e) {
            log.error("[Context] Failed to load customer {}", tenant.getCustomerId(), e);
            return UNAVAILABLE;
        }
        if (found.isEmpty()) {
            log.warn("[Context] Customer not found: {}", tenant.getCustomerId());
            return UNAVAILABLE;
        }

        CustomerRecord customer = found.get();
        List<CustomerEvent> events = customer.getEvents().stream()
                .sorted(Comparator.comparing(CustomerEvent::getEventDate,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .limit(MAX_EVENTS)
                .collect(Collectors.toList());
        List<Project> projects = customer.getProjects().stream()
                .sorted(Comparator.comparing(Project::getUpdatedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .collect(Collectors.toList());
        List<Artifact> artifacts = customer.getArtifacts().stream()
                .sorted(Comparator.comparing(Artifact::getUpdatedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .limit(MAX_ARTIFACTS)
                .collect(Collectors.toList());
        List<ActionItem> openItems = customer.getActionItems().stream()
                .filter(item -> item.getStatus() != null && item.getStatus().isOpen())
                .sorted(Comparator.comparing(ActionItem::getDueDate,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .limit(MAX_ACTION_ITEMS)
                .collect(Collectors.toList());
        List<String> healthSignals = healthSignals(customer, events);

        int budget = properties.getOrchestrator().getContextCharBudget();
        String context = render(customer, healthSignals, events, projects, artifacts, openItems);
        if (context.length() > budget) {
            context = render(customer, healthSignals, head(events, 3), projects, artifacts, openItems);
        }
        if (context.length() > budget) {
            context = render(customer, healthSignals, head(events, 3), head(projects, 5), head(artifacts, 5),
                    head(openItems, 5));
        }
        if (context.length() > budget) {
            context = render(customer, healthSignals, head(events, 3), head(projects, 5), head(artifacts, 5),
                    head(openItems, 3));
        }

        log.debug("[Context] Built context for customer {}: {} chars, {} projects, {} events",
                customer.getId(), context.length(), projects.size(), events.size());
        return context;
    }

    private List<String> healthSignals(CustomerRecord customer, List<CustomerEvent> recentEvents) {
        List<String> signals = new ArrayList<>();
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);

        long overdue = customer.getActionItems().stream()
                .filter(item -> item.getStatus() != null && item.getStatus().isOpen())
                .filter(item -> item.getDueDate() != null && item.getDueDate().isBefore(today))
                .count();
        if (overdue > 0) {
            signals.add(WARNING + overdue + " overdue action item(s)");
        }

        Instant lastEvent = recentEvents.isEmpty() ? null : recentEvents.get(0).getEventDate();
        if (lastEvent == null) {
            signals.add(WARNING + "No recorded interactions");
        } else if (lastEvent.isBefore(now.minus(Duration.ofDays(INACTIVITY_DAYS)))) {
            signals.add(WARNING + "No activity in " + Duration.between(lastEvent, now).toDays() + " days");
        }
        return signals;
    }

    private String render(CustomerRecord customer, List<String> healthSignals, List<CustomerEvent> events,
            List<Project> projects, List<Artifact> artifacts, List<ActionItem> actionItems) {
        Map<String, Object> info = customer.getInfo() != null ? customer.getInfo() : Map.of();
        StringBuilder sb = new StringBuilder();
        sb.append("## Current Customer Context\n\n");
        sb.append("**Today's Date**: ").append(LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC)).append("\n\n");
        sb.append("**Customer**: ").append(customer.getName()).append('\n');
        sb.append("**Customer ID**: ").append(customer.getId()).append('\n');
        sb.append("**Status**: ").append(customer.getStatus() != null ? customer.getStatus().getWireValue() : "unknown")
                .append('\n');
        sb.append("**Vertical**: ").append(infoText(info, "vertical", NOT_SPECIFIED)).append('\n');
        sb.append("**Persona**: ").append(infoText(info, "persona", NOT_SPECIFIED)).append('\n');
        sb.append("**ICP**: ").append(infoText(info, "icp", NOT_SPECIFIED)).append("\n\n");
        sb.append("**About**: ").append(infoText(info, "about", "No description")).append("\n\n");
        sb.append("**Product**: ").append(infoText(info, "product", "No product details")).append("\n\n");

        sb.append("**Team**:\n").append(teamBlock(info)).append("\n\n");

        sb.append("**Health Signals**:\n");
        appendLines(sb, healthSignals.stream().map(s -> "- " + s).collect(Collectors.toList()), "- No concerns");

        sb.append("\n\n**Action Items** (").append(actionItems.size()).append(" pending):\n");
        appendLines(sb, actionItems.stream()
                .map(item -> "- [" + (item.getType() != null ? item.getType().getWireValue() : "custom") + "] "
                        + item.getDescription()
                        + (item.getDueDate() != null ? " (due: " + item.getDueDate() + ")" : "")
                        + " [" + item.getStatus().getWireValue() + "]")
                .collect(Collectors.toList()), "- No pending action items");

        sb.append("\n\n**Active Projects** (").append(customer.getProjects().size()).append("):\n");
        appendLines(sb, projects.stream()
                .map(p -> "- " + p.getName() + " (" + p.getStatus() + ")"
                        + (p.getDescription() != null && !p.getDescription().isBlank()
                                ? " - " + excerpt(p.getDescription(), PROJECT_DESCRIPTION_EXCERPT)
                                : "")
                        + " [id: " + p.getId() + "]")
                .collect(Collectors.toList()), "- No projects");

        sb.append("\n\n**Deliverables** (").append(customer.getArtifacts().size()).append(" total):\n");
        appendLines(sb, artifacts.stream()
                .map(a -> "- " + a.getTitle() + " (" + a.getType() + ", "
                        + (a.getStatus() != null ? a.getStatus().getWireValue() : "draft") + ")")
                .collect(Collectors.toList()), "- No artifacts");

        sb.append("\n\n**Recent Events** (last ").append(events.size()).append("):\n");
        appendLines(sb, events.stream()
                .map(e -> "- [" + (e.getEventDate() != null
                        ? LocalDate.ofInstant(e.getEventDate(), ZoneOffset.UTC).toString()
                        : "?") + "] " + e.getEventType() + ": " + e.getTitle())
                .collect(Collectors.toList()), "- No recent events");

        return sb.toString().strip();
    }

    @SuppressWarnings("unchecked")
    private String teamBlock(Map<String, Object> info) {
        Object team = info.get("team");
        if (!(team instanceof List<?> members) || members.isEmpty()) {
            return "- No team members listed";
        }
        List<String> lines = new ArrayList<>();
        for (Object member : members) {
            if (member instanceof Map<?, ?> map) {
                Map<String, Object> m = (Map<String, Object>) map;
                Object role = m.get("role");
                Object notes = m.get("notes");
                lines.add("- " + m.get("name") + " (" + (role != null ? role : "No role") + ")"
                        + (notes != null ? " - " + notes : ""));
            } else if (member != null) {
                lines.add("- " + member);
            }
        }
        return String.join("\n", lines);
    }

    private static void appendLines(StringBuilder sb, List<String> lines, String emptyLine) {
        sb.append(lines.isEmpty() ? emptyLine : String.join("\n", lines));
    }

    private static String infoText(Map<String, Object> info, String key, String fallback) {
        Object value = info.get(key);
        return value != null && !String.valueOf(value).isBlank() ? String.valueOf(value) : fallback;
    }

    private static String excerpt(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }

    private static <T> List<T> head(List<T> list, int n) {
        return list.size() <= n ? list : list.subList(0, n);
    }
}

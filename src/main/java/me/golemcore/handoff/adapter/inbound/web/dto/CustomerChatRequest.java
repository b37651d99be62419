package me.golemcore.handoff.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.handoff.domain.model.InboundMessage;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerChatRequest {
    private List<InboundMessage> messages;

    /** What the user is looking at in the client. Informational only. */
    private Map<String, Object> screenContext;
}

package com.phillippitts.callbridge.service.data;

import com.phillippitts.callbridge.config.properties.ConfigDataProperties;
import com.phillippitts.callbridge.domain.Contact;
import com.phillippitts.callbridge.domain.TransferDestination;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Builds per-call AI instructions and the greeting line from the config data.
 *
 * <p>Instructions are the system prompt followed by optional sections: business knowledge,
 * transfer options and, for known callers, caller information.
 */
@Component
public class InstructionBuilder {

    private final ConfigDataRepository data;
    private final String businessName;

    public InstructionBuilder(ConfigDataRepository data, ConfigDataProperties properties) {
        this.data = data;
        this.businessName = properties.getBusinessName();
    }

    public String buildInstructions(String callerPhone) {
        StringBuilder sb = new StringBuilder(data.systemPrompt());

        String knowledge = data.businessKnowledge();
        if (!knowledge.isBlank()) {
            sb.append("\n\n## Business Knowledge\n").append(knowledge);
        }

        Map<String, TransferDestination> destinations = data.all();
        if (!destinations.isEmpty()) {
            appendTransferSection(sb, destinations);
        }

        data.contact(callerPhone).ifPresent(contact -> appendCallerSection(sb, contact));
        return sb.toString();
    }

    /**
     * Greeting for the caller: the contact's preferred greeting, else a greeting by name,
     * else the default greeting.
     */
    public String buildGreeting(String callerPhone) {
        Optional<Contact> contact = data.contact(callerPhone);
        if (contact.isPresent() && contact.get().preferredGreeting() != null) {
            return contact.get().preferredGreeting();
        }
        if (contact.isPresent()) {
            return "Hi " + contact.get().name() + "! Thank you for calling " + businessName
                    + ". How can I help you today?";
        }
        return "Thank you for calling " + businessName + "! How can I help you today?";
    }

    private static void appendTransferSection(StringBuilder sb, Map<String, TransferDestination> destinations) {
        sb.append("\n\n## Call Transfer Capability\n")
          .append("You can transfer calls to team members. Available transfer options:\n\n");
        destinations.values().forEach(d -> sb.append("- **").append(d.key()).append("**: ")
                .append(d.name()).append(" (").append(d.description()).append(")\n"));
        sb.append("\n### How to Transfer\n")
          .append("When a caller asks to speak with someone or needs to be transferred:\n")
          .append("1. Confirm who they want to speak with\n")
          .append("2. Say: \"Let me transfer you to [name]. Please hold for a moment.\"\n")
          .append("3. Use the transfer function with the appropriate destination key\n")
          .append("\nIMPORTANT: Only transfer when the caller explicitly requests it or when you cannot help them.\n");
    }

    private static void appendCallerSection(StringBuilder sb, Contact contact) {
        sb.append("\n\n## Caller Information\n");
        sb.append("- Name: ").append(contact.name()).append('\n');
        if (contact.company() != null) {
            sb.append("- Company: ").append(contact.company()).append('\n');
        }
        if (contact.role() != null) {
            sb.append("- Role: ").append(contact.role()).append('\n');
        }
        if (contact.vip()) {
            sb.append("- VIP Client: Yes - provide premium service\n");
        }
        if (contact.notes() != null) {
            sb.append("- Notes: ").append(contact.notes()).append('\n');
        }
    }
}

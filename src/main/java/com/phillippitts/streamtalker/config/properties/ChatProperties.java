package com.phillippitts.streamtalker.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Filtering rules applied to incoming chat and reward events before they are queued.
 */
@Validated
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    /** Platform wildcard for bindings and blacklist entries. */
    public static final String ANY_PLATFORM = "Any";

    /** Queue every chat message, not only reward redemptions. */
    private final boolean readAllMessages;

    /** Drop messages that do not name a voice explicitly. */
    private final boolean requireVoice;

    /** When set, only redemptions of this reward are read. */
    private final String selectedRewardId;

    private final List<Binding> bindings;
    private final List<BlacklistEntry> blacklist;

    @ConstructorBinding
    public ChatProperties(Boolean readAllMessages,
                          Boolean requireVoice,
                          String selectedRewardId,
                          List<Binding> bindings,
                          List<BlacklistEntry> blacklist) {
        this.readAllMessages = readAllMessages == null ? true : readAllMessages;
        this.requireVoice = requireVoice == null ? false : requireVoice;
        this.selectedRewardId = (selectedRewardId == null || selectedRewardId.isBlank()) ? null : selectedRewardId;
        this.bindings = bindings == null ? List.of() : List.copyOf(bindings);
        this.blacklist = blacklist == null ? List.of() : List.copyOf(blacklist);
    }

    public boolean isReadAllMessages() {
        return readAllMessages;
    }

    public boolean isRequireVoice() {
        return requireVoice;
    }

    public String getSelectedRewardId() {
        return selectedRewardId;
    }

    public List<Binding> getBindings() {
        return bindings;
    }

    public List<BlacklistEntry> getBlacklist() {
        return blacklist;
    }

    /**
     * Always speak a user's messages with one voice.
     */
    public record Binding(String username, String platform, String voice, Boolean enabled) {
        public Binding {
            platform = (platform == null || platform.isBlank()) ? ANY_PLATFORM : platform;
            enabled = enabled == null ? Boolean.TRUE : enabled;
        }
    }

    /**
     * Never read messages from this user.
     */
    public record BlacklistEntry(String username, String platform, Boolean enabled) {
        public BlacklistEntry {
            platform = (platform == null || platform.isBlank()) ? ANY_PLATFORM : platform;
            enabled = enabled == null ? Boolean.TRUE : enabled;
        }
    }
}

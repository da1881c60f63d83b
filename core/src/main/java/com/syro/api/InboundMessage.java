package com.syro.api;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A chat event as handed over by the platform listener.
 *
 * @param rawText            full message text, prefix included
 * @param actorId            author of the message
 * @param actorRoleIds       role ids the author holds in the guild (empty in DMs)
 * @param actorCapabilities  platform capabilities of the author
 * @param guildId            guild the message was sent in, {@code null} for direct messages
 * @param channelId          channel to reply to, may be {@code null}
 */
public record InboundMessage(String rawText,
                             String actorId,
                             List<String> actorRoleIds,
                             Set<Capability> actorCapabilities,
                             String guildId,
                             String channelId) {

    public InboundMessage {
        Objects.requireNonNull(actorId, "actorId");
        rawText = rawText == null ? "" : rawText;
        actorRoleIds = actorRoleIds == null ? List.of() : List.copyOf(actorRoleIds);
        actorCapabilities = actorCapabilities == null ? Set.of() : Set.copyOf(actorCapabilities);
    }

    public boolean hasAdministerCapability() {
        return actorCapabilities.contains(Capability.ADMINISTER);
    }

    public boolean isFromGuild() {
        return guildId != null;
    }
}

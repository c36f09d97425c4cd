package relay.core.service.registration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import relay.core.config.CommandConfig;
import relay.core.config.RegistryConfig;
import relay.core.model.command.RelayStatus;

/**
 * User-facing message texts.
 *
 * <p>Only {@link #groupIdentifier} carries an identifier; it is sent to private chats only.
 */
@ApplicationScoped
public class RelayMessages {

    private final String command;
    private final long ttlMinutes;

    @Inject
    public RelayMessages(CommandConfig commandConfig, RegistryConfig registryConfig) {
        this.command = "/" + commandConfig.name();
        this.ttlMinutes = Math.max(1, registryConfig.ttl().toMinutes());
    }

    public String registrationAcknowledgement() {
        return "Hey there! I fetch group IDs without posting them in the group.\n\n"
                + "Here's how this works:\n"
                + "1. Add me as an admin to a group you manage\n"
                + "2. Send " + command + " in that group\n"
                + "3. I'll message you the group's ID right here\n"
                + "4. I forget everything after " + ttlMinutes + " minutes.";
    }

    public String groupIdentifier(String groupTitle, String groupId) {
        final var title = groupTitle == null || groupTitle.isBlank() ? "Unnamed Group" : groupTitle;
        return "Group found!\n\n"
                + "Title: " + title + "\n"
                + "ID: " + groupId + "\n\n"
                + "Copy the ID above. This info will be forgotten in " + ttlMinutes + " minutes.";
    }

    public String checkPrivateMessages() {
        return "Done! Check your private messages with me.";
    }

    public String adminsOnly() {
        return "Sorry, only group admins can use this command. If you are one, please try again shortly.";
    }

    public String privateChatRequired() {
        return "I couldn't message you privately. Open a private chat with me, send " + command
                + ", then try again here.";
    }

    public String help() {
        return "Group ID relay\n\n"
                + "I help you get chat group IDs safely and privately.\n\n"
                + "How to use:\n"
                + "1. Start me in a private chat with " + command + "\n"
                + "2. Add me as admin to your group\n"
                + "3. Send " + command + " in that group\n"
                + "4. I'll message you the group ID privately\n\n"
                + "Privacy: I only keep info in memory for " + ttlMinutes + " minutes, then forget it completely.\n\n"
                + "Commands:\n"
                + command + " - Register privately or get the group ID\n"
                + "/help - Show this help message\n"
                + "/status - Show current memory usage";
    }

    public String status(RelayStatus status) {
        return "Relay status\n\n"
                + "Pending registrations: " + status.liveEntryCount() + "\n"
                + "Entry TTL: " + status.ttl().toSeconds() + " seconds\n\n"
                + "All data is stored in RAM only and expires automatically.";
    }

    public String privateHint() {
        return "Hey! Use " + command + " to get started, or /help for more info.";
    }
}

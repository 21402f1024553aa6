package io.taskrelay.client;

import java.util.ArrayList;
import java.util.List;

import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.AgentSkill;
import io.taskrelay.spec.Artifact;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.Part;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TextPart;
import org.jspecify.annotations.Nullable;

/**
 * Helpers to build outgoing messages and read the outcome of a delegated task.
 */
public final class TaskResults {

    public static final String DEFAULT_QUESTION = "Agent requires input";

    private TaskResults() {
    }

    public static Message createMessage(String text) {
        return createMessage(text, null);
    }

    /**
     * @param text the prompt
     * @param taskId the task the message continues, or {@code null} to start a new one
     * @return a user message with a single text part
     */
    public static Message createMessage(String text, @Nullable String taskId) {
        return Message.builder()
                .role(Message.Role.ROLE_USER)
                .parts(new TextPart(text))
                .taskId(taskId)
                .build();
    }

    /**
     * Joins the text parts of every artifact, one per line.
     *
     * @param task the finished task
     * @return the text, or {@code null} when no artifact carries text
     */
    public static @Nullable String extractText(Task task) {
        List<String> texts = new ArrayList<>();
        for (Artifact artifact : task.artifactsOrEmpty()) {
            for (Part<?> part : artifact.parts()) {
                if (part instanceof TextPart textPart) {
                    texts.add(textPart.text());
                }
            }
        }
        return texts.isEmpty() ? null : String.join("\n", texts);
    }

    /**
     * @param task a task waiting for input
     * @return the first text part of its status message, or {@link #DEFAULT_QUESTION}
     */
    public static String extractQuestion(Task task) {
        Message message = task.status().message();
        if (message != null) {
            for (Part<?> part : message.parts()) {
                if (part instanceof TextPart textPart) {
                    return textPart.text();
                }
            }
        }
        return DEFAULT_QUESTION;
    }

    /**
     * Renders a card as a short markdown description, suitable for listing the agents a
     * caller may delegate to.
     */
    public static String cardToPrompt(AgentCard card) {
        StringBuilder sb = new StringBuilder();
        sb.append("## ").append(card.name()).append('\n');
        sb.append(card.description()).append('\n');
        if (!card.skills().isEmpty()) {
            sb.append('\n').append("Skills:").append('\n');
            for (AgentSkill skill : card.skills()) {
                sb.append("- ").append(skill.name()).append(": ").append(skill.description()).append('\n');
            }
        }
        return sb.toString();
    }
}

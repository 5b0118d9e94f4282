package com.frameception.core.conversation;

import com.frameception.core.model.Job;
import com.frameception.core.model.Project;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Renders the setup and update jobs of a project as a conversation, newest first.
 */
public final class ConversationView {

    static final String PROCESSING = "Processing...";

    private ConversationView() {}

    public static List<ConversationTurn> turns(Project project) {
        if (project == null) {
            return List.of();
        }
        return project.jobs().stream()
                .filter(job -> job.type().statusRelevant())
                .sorted(Comparator.comparing(Job::createdAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .map(ConversationView::toTurn)
                .toList();
    }

    private static ConversationTurn toTurn(Job job) {
        String reply;
        boolean error = false;
        if (job.inProgress()) {
            reply = PROCESSING;
        } else if (job.data().hasError()) {
            reply = job.data().error();
            error = true;
        } else {
            reply = job.data().result() != null ? job.data().result() : "";
        }
        String prompt = job.data().prompt() != null ? job.data().prompt() : "";
        return new ConversationTurn(job.id(), prompt, reply, error, job.createdAt());
    }
}

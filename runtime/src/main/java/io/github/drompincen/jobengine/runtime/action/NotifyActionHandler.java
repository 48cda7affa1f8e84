package io.github.drompincen.jobengine.runtime.action;

import io.github.drompincen.jobengine.persistence.document.ScheduledJobDocument;
import io.github.drompincen.jobengine.protocol.api.ActionType;
import io.github.drompincen.jobengine.protocol.api.NotifyPayload;
import io.github.drompincen.jobengine.runtime.port.DeliveryResult;
import io.github.drompincen.jobengine.runtime.port.NotificationMessage;
import io.github.drompincen.jobengine.runtime.port.NotificationTransport;
import io.github.drompincen.jobengine.runtime.port.TaskDirectory;
import io.github.drompincen.jobengine.runtime.port.TaskInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

@Component
public class NotifyActionHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(NotifyActionHandler.class);
    private static final DateTimeFormatter DUE_FMT =
            DateTimeFormatter.ofPattern("EEE, MMM d yyyy h:mm a z", Locale.US);

    private final NotificationTransport transport;
    private final TaskDirectory taskDirectory;
    private final String defaultChannel;

    public NotifyActionHandler(NotificationTransport transport,
                               TaskDirectory taskDirectory,
                               @Value("${jobengine.defaults.channel:app}") String defaultChannel) {
        this.transport = transport;
        this.taskDirectory = taskDirectory;
        this.defaultChannel = defaultChannel;
    }

    @Override
    public ActionType actionType() {
        return ActionType.NOTIFY;
    }

    @Override
    public ActionOutcome execute(DispatchContext context) {
        ScheduledJobDocument job = context.job();
        NotifyPayload payload = (NotifyPayload) context.payload();

        String message = payload.message() != null && !payload.message().isBlank()
                ? payload.message() : job.getTitle();
        String channel = payload.preferredChannel() != null ? payload.preferredChannel() : defaultChannel;

        StringBuilder content = new StringBuilder("**Reminder:** ").append(message);
        if (job.getTaskId() != null) {
            Optional<TaskInfo> task = taskDirectory.findTask(job.getOwnerId(), job.getTaskId());
            task.ifPresent(t -> {
                content.append("\n\n**Task:** ").append(t.title());
                if (t.dueDate() != null) {
                    content.append("\n**Due:** ").append(DUE_FMT.format(t.dueDate().atZone(zoneOf(job))));
                }
            });
        }

        DeliveryResult result = transport.send(job.getOwnerId(), channel,
                new NotificationMessage(job.getTitle(), content.toString(), job.getJobId(), job.getTaskId()));
        if (!result.accepted()) {
            log.warn("Transport rejected notification for job {}: {}", job.getJobId(), result.error());
            return ActionOutcome.failure("Delivery failed: " + result.error());
        }
        return ActionOutcome.success("Notified via " + channel);
    }

    private static ZoneId zoneOf(ScheduledJobDocument job) {
        try {
            return job.getTimezone() != null ? ZoneId.of(job.getTimezone()) : ZoneId.of("UTC");
        } catch (DateTimeException e) {
            return ZoneId.of("UTC");
        }
    }
}

package org.neuralchilli.flotilla.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.flotilla.domain.TaskInstance;
import org.neuralchilli.flotilla.domain.TaskStatus;

import java.io.IOException;
import java.time.Instant;
import java.util.UUID;

/**
 * Compact binary serializer for TaskInstance, the most frequently written value.
 * Instants keep nanosecond precision: start and ready times are compared with each other.
 */
public class TaskInstanceSerializer implements StreamSerializer<TaskInstance> {

    private static final int TYPE_ID = 1001;

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, TaskInstance task) throws IOException {
        writeUuid(out, task.id());
        writeUuid(out, task.workflowId());

        out.writeString(task.groupName());
        out.writeString(task.taskName());
        out.writeBoolean(task.lead());
        out.writeInt(task.retryId());

        // Status (ordinal for efficiency)
        out.writeInt(task.status().ordinal());

        writeStringOrNull(out, task.node());
        writeStringOrNull(out, task.reason());
        writeIntOrNull(out, task.exitCode());
        out.writeInt(task.restartCount());

        writeInstant(out, task.createdAt());
        writeInstantOrNull(out, task.scheduledAt());
        writeInstantOrNull(out, task.readyAt());
        writeInstantOrNull(out, task.startedAt());
        writeInstantOrNull(out, task.finishedAt());
        writeInstantOrNull(out, task.eligibleAt());
    }

    @Override
    public TaskInstance read(ObjectDataInput in) throws IOException {
        UUID id = readUuid(in);
        UUID workflowId = readUuid(in);

        String groupName = in.readString();
        String taskName = in.readString();
        boolean lead = in.readBoolean();
        int retryId = in.readInt();

        TaskStatus status = TaskStatus.values()[in.readInt()];

        String node = readStringOrNull(in);
        String reason = readStringOrNull(in);
        Integer exitCode = readIntOrNull(in);
        int restartCount = in.readInt();

        Instant createdAt = readInstant(in);
        Instant scheduledAt = readInstantOrNull(in);
        Instant readyAt = readInstantOrNull(in);
        Instant startedAt = readInstantOrNull(in);
        Instant finishedAt = readInstantOrNull(in);
        Instant eligibleAt = readInstantOrNull(in);

        return new TaskInstance(
                id,
                workflowId,
                groupName,
                taskName,
                lead,
                retryId,
                status,
                node,
                reason,
                exitCode,
                restartCount,
                createdAt,
                scheduledAt,
                readyAt,
                startedAt,
                finishedAt,
                eligibleAt
        );
    }

    private void writeUuid(ObjectDataOutput out, UUID value) throws IOException {
        out.writeLong(value.getMostSignificantBits());
        out.writeLong(value.getLeastSignificantBits());
    }

    private UUID readUuid(ObjectDataInput in) throws IOException {
        long mostSigBits = in.readLong();
        long leastSigBits = in.readLong();
        return new UUID(mostSigBits, leastSigBits);
    }

    // Helper methods for nullable values
    private void writeStringOrNull(ObjectDataOutput out, String value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            out.writeString(value);
        }
    }

    private String readStringOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        return hasValue ? in.readString() : null;
    }

    private void writeIntOrNull(ObjectDataOutput out, Integer value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            out.writeInt(value);
        }
    }

    private Integer readIntOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        return hasValue ? in.readInt() : null;
    }

    private void writeInstant(ObjectDataOutput out, Instant value) throws IOException {
        out.writeLong(value.getEpochSecond());
        out.writeInt(value.getNano());
    }

    private Instant readInstant(ObjectDataInput in) throws IOException {
        long seconds = in.readLong();
        int nanos = in.readInt();
        return Instant.ofEpochSecond(seconds, nanos);
    }

    private void writeInstantOrNull(ObjectDataOutput out, Instant value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            writeInstant(out, value);
        }
    }

    private Instant readInstantOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        return hasValue ? readInstant(in) : null;
    }

    @Override
    public void destroy() {
        // No resources to clean up
    }
}

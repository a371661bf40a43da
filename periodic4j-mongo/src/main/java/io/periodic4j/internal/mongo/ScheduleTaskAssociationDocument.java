package io.periodic4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Mongo document model for owner → schedule entry links.
 */
@Document(collection = "schedule_task_associations")
public class ScheduleTaskAssociationDocument {

    @Id
    private String id;

    private String taskId;
    private String discriminator;
    private long discriminatorId;
    private String attribute = "";
    private String description;

    public ScheduleTaskAssociationDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTaskId() {
        return taskId;
    }

    public void setTaskId(String taskId) {
        this.taskId = taskId;
    }

    public String getDiscriminator() {
        return discriminator;
    }

    public void setDiscriminator(String discriminator) {
        this.discriminator = discriminator;
    }

    public long getDiscriminatorId() {
        return discriminatorId;
    }

    public void setDiscriminatorId(long discriminatorId) {
        this.discriminatorId = discriminatorId;
    }

    public String getAttribute() {
        return attribute;
    }

    public void setAttribute(String attribute) {
        this.attribute = attribute;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}

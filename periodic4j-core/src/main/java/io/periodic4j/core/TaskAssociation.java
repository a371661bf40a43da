package io.periodic4j.core;

/**
 * Link from an owner, identified by {@code (discriminator, discriminatorId)}, to the schedule entry it created.
 */
public class TaskAssociation {

    private String id;
    private String taskId;
    private String discriminator;
    private long discriminatorId;
    private String attribute = "";
    private String description;

    public TaskAssociation() {
    }

    public static TaskAssociation forOwner(OwnerKey owner, String attribute, String description) {
        TaskAssociation association = new TaskAssociation();
        association.setDiscriminator(owner.discriminator());
        association.setDiscriminatorId(owner.discriminatorId());
        association.setAttribute(attribute);
        association.setDescription(description);
        return association;
    }

    public OwnerKey ownerKey() {
        return new OwnerKey(discriminator, discriminatorId);
    }

    public boolean belongsTo(OwnerKey owner) {
        return owner != null
                && owner.discriminatorId() == discriminatorId
                && owner.discriminator().equals(discriminator);
    }

    public boolean isPersisted() {
        return id != null;
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
        this.attribute = attribute == null ? "" : attribute;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    @Override
    public String toString() {
        return "TaskAssociation{id=" + id + ", taskId=" + taskId + ", owner=" + discriminator + "#"
                + discriminatorId + ", attribute=" + attribute + "}";
    }
}

package com.acme.store.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Queue naming and event publishing settings. Pure POJO - no framework dependencies.
 */
public class MessagingConfig {

  /** How committed events reach the bus. */
  public enum PublishMode {
    /** Straight to the bus after commit. */
    DIRECT,
    /** Staged in the outbox inside the transaction, relayed after commit. */
    OUTBOX
  }

  private PublishMode publishMode = PublishMode.DIRECT;
  private String eventTopic = "store.events";
  private QueueNaming queueNaming = new QueueNaming();
  private List<String> projectionQueues = new ArrayList<>();

  public PublishMode getPublishMode() {
    return publishMode;
  }

  public void setPublishMode(PublishMode publishMode) {
    this.publishMode = publishMode;
  }

  public String getEventTopic() {
    return eventTopic;
  }

  public void setEventTopic(String eventTopic) {
    this.eventTopic = eventTopic;
  }

  public QueueNaming getQueueNaming() {
    return queueNaming;
  }

  public void setQueueNaming(QueueNaming queueNaming) {
    this.queueNaming = queueNaming;
  }

  /** Queue names every published event is fanned out to. */
  public List<String> getProjectionQueues() {
    return projectionQueues;
  }

  public void setProjectionQueues(List<String> projectionQueues) {
    this.projectionQueues = projectionQueues;
  }

  public static class QueueNaming {
    private String projectionPrefix = "STORE.PROJ.";
    private String queueSuffix = ".Q";

    public String getProjectionPrefix() {
      return projectionPrefix;
    }

    public void setProjectionPrefix(String projectionPrefix) {
      this.projectionPrefix = projectionPrefix;
    }

    public String getQueueSuffix() {
      return queueSuffix;
    }

    public void setQueueSuffix(String queueSuffix) {
      this.queueSuffix = queueSuffix;
    }

    /** Example: order-read-model -> STORE.PROJ.ORDER-READ-MODEL.Q */
    public String buildProjectionQueue(String projectionName) {
      return projectionPrefix + projectionName.toUpperCase(Locale.ROOT) + queueSuffix;
    }
  }
}

package io.cubebloc.rabbitmq.channel;

import java.util.Objects;

/**
 * Channels are shared by clients of the same queue on the same broker profile only.
 */
final class ChannelKey {
  private final String profile;
  private final String queueName;

  ChannelKey(String profile, String queueName) {
    this.profile = profile;
    this.queueName = queueName;
  }

  String getQueueName() {
    return queueName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ChannelKey that = (ChannelKey) o;
    return profile.equals(that.profile) && queueName.equals(that.queueName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(profile, queueName);
  }

  @Override
  public String toString() {
    return "queue '" + queueName + "' of profile '" + profile + "'";
  }
}

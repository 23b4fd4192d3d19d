package io.cubebloc.rabbitmq;

import static com.rabbitmq.client.ConnectionFactory.DEFAULT_PASS;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_USER;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableMap;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import java.io.IOException;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
public class QueueClientIntegrationTest {
  private static final String QUEUE_NAME = "cubebloc-queue-client-test";
  private static final long TIMEOUT_SEC = 10;
  private static final long RECEIVE_TIMEOUT_MS = 5000;

  @Container
  public static GenericContainer<?> rabbit = new GenericContainer<>("rabbitmq:3-management").withExposedPorts(5672);

  private CachingConnectionFactory adminConnectionFactory;
  private RabbitAdmin admin;
  private QueueClientFactory factory;
  private QueueClient client;

  @BeforeEach
  public void setUp() throws Exception {
    adminConnectionFactory = new CachingConnectionFactory(rabbit.getHost(), rabbit.getFirstMappedPort());
    adminConnectionFactory.setUsername(DEFAULT_USER);
    adminConnectionFactory.setPassword(DEFAULT_PASS);
    admin = new RabbitAdmin(adminConnectionFactory);
    admin.afterPropertiesSet();

    String url = "amqp://" + DEFAULT_USER + ":" + DEFAULT_PASS + "@" + rabbit.getHost() + ":" + rabbit.getFirstMappedPort();
    factory = new QueueClientFactory(BrokerProfiles.of(url), new Properties());
    client = factory.createClient(QUEUE_NAME);
    client.connect().get(TIMEOUT_SEC, TimeUnit.SECONDS);
    client.createChannel().get(TIMEOUT_SEC, TimeUnit.SECONDS);
  }

  @AfterEach
  public void tearDown() throws Exception {
    client.closeConnection().get(TIMEOUT_SEC, TimeUnit.SECONDS);
    factory.close();
    admin.deleteQueue(QUEUE_NAME);
    adminConnectionFactory.destroy();
  }

  @Test
  public void createChannelDeclaresQueue() {
    assertEquals(QueueClient.State.CHANNEL_READY, client.getState());
    assertNotNull(admin.getQueueProperties(QUEUE_NAME));
  }

  @Test
  public void insertedMessageReachesQueue() {
    assertTrue(client.insert(ImmutableMap.of("test", "data")));

    Message message = new RabbitTemplate(adminConnectionFactory).receive(QUEUE_NAME, RECEIVE_TIMEOUT_MS);
    assertNotNull(message);
    assertEquals("{\"test\":\"data\"}", new String(message.getBody(), UTF_8));
  }

  @Test
  public void groupByKeyIsSentAsHeader() {
    assertTrue(client.insertWithGroupBy("user-1", ImmutableMap.of("test", "data")));

    Message message = new RabbitTemplate(adminConnectionFactory).receive(QUEUE_NAME, RECEIVE_TIMEOUT_MS);
    assertNotNull(message);
    assertEquals("user-1", String.valueOf(message.getMessageProperties().getHeaders().get(QueueClient.GROUP_BY_HEADER)));
  }

  @Test
  public void purgeEmptiesQueue() throws Exception {
    client.insert(ImmutableMap.of("test", "data"));
    client.insert(ImmutableMap.of("test", "data"));

    AMQP.Queue.PurgeOk purgeOk = client.purge().get(TIMEOUT_SEC, TimeUnit.SECONDS);

    assertEquals(2, purgeOk.getMessageCount());
    assertEquals(0, admin.getQueueProperties(QUEUE_NAME).get(RabbitAdmin.QUEUE_MESSAGE_COUNT));
  }

  @Test
  public void destroyDeletesQueue() throws Exception {
    client.destroy().get(TIMEOUT_SEC, TimeUnit.SECONDS);

    assertEquals(QueueClient.State.QUEUE_DESTROYED, client.getState());
    assertNull(admin.getQueueProperties(QUEUE_NAME));
  }

  @Test
  public void channelKilledByBrokerIsRebuilt() throws Exception {
    Channel dead = client.getChannel().get();
    // broker closes the channel on a passive declaration of a missing queue
    assertThrows(IOException.class, () -> dead.queueDeclarePassive(QUEUE_NAME + "-missing"));
    awaitChannelEviction();
    assertEquals(QueueClient.State.CHANNEL_PENDING, client.getState());

    Channel rebuilt = client.createChannel().get(TIMEOUT_SEC, TimeUnit.SECONDS);

    assertNotSame(dead, rebuilt);
    assertTrue(rebuilt.isOpen());
    assertTrue(client.insert(ImmutableMap.of("test", "data")));
    assertNotNull(new RabbitTemplate(adminConnectionFactory).receive(QUEUE_NAME, RECEIVE_TIMEOUT_MS));
  }

  @Test
  public void closeConnectionReleasesChannel() throws Exception {
    client.closeConnection().get(TIMEOUT_SEC, TimeUnit.SECONDS);

    assertEquals(QueueClient.State.CONNECTION_CLOSED, client.getState());
    assertFalse(client.getChannel().isPresent());
    assertThrows(ConfigException.class, () -> client.insert(ImmutableMap.of("test", "data")));
  }

  private void awaitChannelEviction() throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SEC);
    while (client.getChannel().isPresent() && System.nanoTime() < deadline) {
      Thread.sleep(50);
    }
    assertFalse(client.getChannel().isPresent());
  }
}

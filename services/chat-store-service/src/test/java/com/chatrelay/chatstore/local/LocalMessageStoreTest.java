package com.chatrelay.chatstore.local;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chatrelay.chatstore.store.IncomingMessage;
import com.chatrelay.chatstore.store.MediaAttachment;
import com.chatrelay.chatstore.store.MediaInfo;
import com.chatrelay.chatstore.store.MediaInfoUnavailableException;
import com.chatrelay.chatstore.store.StoreCapability;
import com.chatrelay.chatstore.store.StoredMessage;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

class LocalMessageStoreTest {

  private static final Instant T1 = Instant.parse("2024-05-01T10:00:00Z");
  private static final Instant T2 = Instant.parse("2024-05-01T10:05:00Z");
  private static final Instant T3 = Instant.parse("2024-05-01T10:10:00Z");

  private JdbcTemplate jdbc;
  private LocalMessageStore store;

  @BeforeEach
  void setUp() {
    DriverManagerDataSource ds =
        new DriverManagerDataSource("jdbc:hsqldb:mem:chatstore-" + UUID.randomUUID(), "SA", "");
    ds.setDriverClassName("org.hsqldb.jdbc.JDBCDriver");
    Flyway.configure().dataSource(ds).locations("classpath:db/migration/local").load().migrate();
    jdbc = new JdbcTemplate(ds);
    store =
        new LocalMessageStore(jdbc, new TransactionTemplate(new DataSourceTransactionManager(ds)));
  }

  @Test
  void chatsAreListedMostRecentFirst() {
    store.storeChat("a@x", "Alice", T1);
    store.storeChat("b@x", "Bob", T2);

    Map<String, Instant> chats = store.getChats();

    assertThat(chats.keySet()).containsExactly("b@x", "a@x");
    assertThat(chats).containsEntry("a@x", T1);
  }

  @Test
  void chatSyncWithoutNameKeepsTheKnownName() {
    store.storeChat("a@x", "Alice", T1);
    store.storeChat("a@x", "", T2);

    String name = jdbc.queryForObject("SELECT name FROM chats WHERE jid = ?", String.class, "a@x");
    assertThat(name).isEqualTo("Alice");
    assertThat(store.getChats()).containsEntry("a@x", T2);
  }

  @Test
  void messagesAreReturnedNewestFirstUpToTheLimit() {
    store.storeMessage(text("m1", "first", T1));
    store.storeMessage(text("m2", "second", T2));
    store.storeMessage(text("m3", "third", T3));

    List<StoredMessage> messages = store.getMessages("a@x", 2);

    assertThat(messages).extracting(StoredMessage::id).containsExactly("m3", "m2");
    assertThat(messages.get(0).timestamp()).isEqualTo(T3);
    assertThat(store.getMessages("a@x", 0)).isEmpty();
  }

  @Test
  void messageForUnseenChatRegistersTheChat() {
    store.storeMessage(text("m1", "hello", T2));

    assertThat(store.getChats()).containsEntry("a@x", T2);
  }

  @Test
  void olderMessageDoesNotMoveLastMessageTimeBack() {
    store.storeChat("a@x", "Alice", T3);
    store.storeMessage(text("m1", "late delivery", T1));

    assertThat(store.getChats()).containsEntry("a@x", T3);
  }

  @Test
  void redeliveredMessageReplacesTheStoredRow() {
    store.storeMessage(text("m1", "draft", T1));
    store.storeMessage(text("m1", "edited", T1));

    List<StoredMessage> messages = store.getMessages("a@x", 10);
    assertThat(messages).hasSize(1);
    assertThat(messages.get(0).content()).isEqualTo("edited");
  }

  @Test
  void emptyMessageIsSkipped() {
    assertThat(store.storeMessage(text("m1", "", T1))).isFalse();

    assertThat(store.getMessages("a@x", 10)).isEmpty();
    assertThat(store.getChats()).isEmpty();
  }

  @Test
  void mediaDescriptorIsKept() {
    MediaAttachment media =
        new MediaAttachment(
            "image",
            "photo.jpg",
            "https://mmg.example/abc",
            new byte[] {1, 2, 3},
            new byte[] {4, 5},
            new byte[] {6},
            2048L);
    store.storeMessage(new IncomingMessage("m1", "a@x", "a@x", null, "", T1, false, media));

    MediaInfo info = store.getMediaInfo("m1", "a@x");

    assertThat(info.mediaType()).isEqualTo("image");
    assertThat(info.filename()).isEqualTo("photo.jpg");
    assertThat(info.url()).isEqualTo("https://mmg.example/abc");
    assertThat(info.mediaKey()).containsExactly(1, 2, 3);
    assertThat(info.fileSha256()).containsExactly(4, 5);
    assertThat(info.fileEncSha256()).containsExactly(6);
    assertThat(info.fileLength()).isEqualTo(2048L);
  }

  @Test
  void mediaInfoIsUnavailableForTextOrUnknownMessages() {
    store.storeMessage(text("m1", "just text", T1));

    assertThatThrownBy(() -> store.getMediaInfo("m1", "a@x"))
        .isInstanceOf(MediaInfoUnavailableException.class);
    assertThatThrownBy(() -> store.getMediaInfo("nope", "a@x"))
        .isInstanceOf(MediaInfoUnavailableException.class);
  }

  @Test
  void everyCapabilityIsSupported() {
    for (StoreCapability capability : StoreCapability.values()) {
      assertThat(store.supports(capability)).isTrue();
    }
  }

  private static IncomingMessage text(String id, String content, Instant ts) {
    return new IncomingMessage(id, "a@x", "a@x", null, content, ts, false, null);
  }
}

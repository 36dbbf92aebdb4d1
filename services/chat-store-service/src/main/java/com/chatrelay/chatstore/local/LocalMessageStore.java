package com.chatrelay.chatstore.local;

import com.chatrelay.chatstore.store.IncomingMessage;
import com.chatrelay.chatstore.store.MediaAttachment;
import com.chatrelay.chatstore.store.MediaInfo;
import com.chatrelay.chatstore.store.MediaInfoUnavailableException;
import com.chatrelay.chatstore.store.MessageStore;
import com.chatrelay.chatstore.store.StoreCapability;
import com.chatrelay.chatstore.store.StoredMessage;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Embedded backend keeping chats and messages, media descriptors included, in a local HSQLDB
 * file. Every capability is supported.
 */
@Slf4j
public class LocalMessageStore implements MessageStore {

  static final String BACKEND = "local";

  private static final String UPSERT_CHAT_SQL =
      """
      MERGE INTO chats c
      USING (VALUES(CAST(? AS VARCHAR(255)), CAST(? AS VARCHAR(1024)), CAST(? AS BIGINT)))
         AS v(jid, name, last_ms)
         ON c.jid = v.jid
      WHEN MATCHED THEN UPDATE SET c.name = COALESCE(v.name, c.name), c.last_message_ms = v.last_ms
      WHEN NOT MATCHED THEN INSERT (jid, name, last_message_ms) VALUES (v.jid, v.name, v.last_ms)
      """;

  // Message writes only move the chat's last message time forward.
  private static final String TOUCH_CHAT_SQL =
      """
      MERGE INTO chats c
      USING (VALUES(CAST(? AS VARCHAR(255)), CAST(? AS BIGINT))) AS v(jid, last_ms)
         ON c.jid = v.jid
      WHEN MATCHED THEN UPDATE
           SET c.last_message_ms = GREATEST(COALESCE(c.last_message_ms, 0), v.last_ms)
      WHEN NOT MATCHED THEN INSERT (jid, last_message_ms) VALUES (v.jid, v.last_ms)
      """;

  private static final String UPSERT_MESSAGE_SQL =
      """
      MERGE INTO messages m
      USING (VALUES(
          CAST(? AS VARCHAR(255)), CAST(? AS VARCHAR(255)), CAST(? AS VARCHAR(255)),
          CAST(? AS VARCHAR(65536)), CAST(? AS BIGINT), CAST(? AS BOOLEAN),
          CAST(? AS VARCHAR(64)), CAST(? AS VARCHAR(1024)), CAST(? AS VARCHAR(4096)),
          CAST(? AS VARBINARY(1024)), CAST(? AS VARBINARY(64)), CAST(? AS VARBINARY(64)),
          CAST(? AS BIGINT)))
         AS v(id, chat_jid, sender, content, ts, from_me, media_type, filename, url,
              media_key, file_sha256, file_enc_sha256, file_length)
         ON m.id = v.id AND m.chat_jid = v.chat_jid
      WHEN MATCHED THEN UPDATE SET
           m.sender = v.sender, m.content = v.content, m.ts_epoch_ms = v.ts,
           m.is_from_me = v.from_me, m.media_type = v.media_type, m.filename = v.filename,
           m.url = v.url, m.media_key = v.media_key, m.file_sha256 = v.file_sha256,
           m.file_enc_sha256 = v.file_enc_sha256, m.file_length = v.file_length
      WHEN NOT MATCHED THEN INSERT
           (id, chat_jid, sender, content, ts_epoch_ms, is_from_me, media_type, filename, url,
            media_key, file_sha256, file_enc_sha256, file_length)
           VALUES (v.id, v.chat_jid, v.sender, v.content, v.ts, v.from_me, v.media_type,
                   v.filename, v.url, v.media_key, v.file_sha256, v.file_enc_sha256,
                   v.file_length)
      """;

  private static final String SELECT_MESSAGES_SQL =
      """
      SELECT id, chat_jid, sender, content, ts_epoch_ms, is_from_me, media_type
        FROM messages
       WHERE chat_jid = ?
    ORDER BY ts_epoch_ms DESC, id DESC
       LIMIT ?
      """;

  private static final String SELECT_CHATS_SQL =
      """
      SELECT jid, last_message_ms
        FROM chats
    ORDER BY last_message_ms DESC NULLS LAST, jid ASC
      """;

  private static final String SELECT_MEDIA_SQL =
      """
      SELECT media_type, filename, url, media_key, file_sha256, file_enc_sha256, file_length
        FROM messages
       WHERE id = ?
         AND chat_jid = ?
      """;

  private static final RowMapper<StoredMessage> MESSAGE_MAPPER =
      (rs, rowNum) ->
          new StoredMessage(
              rs.getString("id"),
              rs.getString("chat_jid"),
              rs.getString("sender"),
              rs.getString("content"),
              Instant.ofEpochMilli(rs.getLong("ts_epoch_ms")),
              rs.getBoolean("is_from_me"),
              rs.getString("media_type"));

  private static final RowMapper<MediaInfo> MEDIA_MAPPER =
      (rs, rowNum) ->
          new MediaInfo(
              rs.getString("media_type"),
              rs.getString("filename"),
              rs.getString("url"),
              rs.getBytes("media_key"),
              rs.getBytes("file_sha256"),
              rs.getBytes("file_enc_sha256"),
              rs.getLong("file_length"));

  private final JdbcTemplate jdbc;
  private final TransactionTemplate tx;

  public LocalMessageStore(JdbcTemplate jdbc, TransactionTemplate tx) {
    this.jdbc = jdbc;
    this.tx = tx;
  }

  @Override
  public void storeChat(String chatJid, String name, Instant lastMessageTime) {
    if (lastMessageTime == null) {
      throw new IllegalArgumentException("lastMessageTime is required");
    }
    String normalizedName = name == null || name.isEmpty() ? null : name;
    jdbc.update(UPSERT_CHAT_SQL, chatJid, normalizedName, lastMessageTime.toEpochMilli());
  }

  @Override
  public boolean storeMessage(IncomingMessage message) {
    if (message.isEmpty()) {
      return false;
    }
    if (message.timestamp() == null) {
      throw new IllegalArgumentException("timestamp is required");
    }
    String id =
        message.id() == null || message.id().isEmpty()
            ? UUID.randomUUID().toString()
            : message.id();
    MediaAttachment media = message.media();
    long ts = message.timestamp().toEpochMilli();
    String mediaType = message.mediaTypeOrEmpty();

    tx.executeWithoutResult(
        status -> {
          jdbc.update(TOUCH_CHAT_SQL, message.chatJid(), ts);
          jdbc.update(
              UPSERT_MESSAGE_SQL,
              id,
              message.chatJid(),
              message.sender(),
              message.contentOrEmpty(),
              ts,
              message.fromMe(),
              mediaType.isEmpty() ? null : mediaType,
              media == null ? null : media.filename(),
              media == null ? null : media.url(),
              media == null ? null : media.mediaKey(),
              media == null ? null : media.fileSha256(),
              media == null ? null : media.fileEncSha256(),
              media == null ? null : media.fileLength());
        });
    return true;
  }

  @Override
  public List<StoredMessage> getMessages(String chatJid, int limit) {
    // HSQLDB reads LIMIT 0 as "no limit"
    if (limit <= 0) {
      return List.of();
    }
    return jdbc.query(SELECT_MESSAGES_SQL, MESSAGE_MAPPER, chatJid, limit);
  }

  @Override
  public Map<String, Instant> getChats() {
    Map<String, Instant> chats = new LinkedHashMap<>();
    jdbc.query(
        SELECT_CHATS_SQL,
        rs -> {
          long ms = rs.getLong("last_message_ms");
          chats.put(rs.getString("jid"), rs.wasNull() ? null : Instant.ofEpochMilli(ms));
        });
    return chats;
  }

  @Override
  public MediaInfo getMediaInfo(String messageId, String chatJid) {
    List<MediaInfo> rows = jdbc.query(SELECT_MEDIA_SQL, MEDIA_MAPPER, messageId, chatJid);
    if (rows.isEmpty()) {
      throw new MediaInfoUnavailableException(
          "message " + messageId + " not found in chat " + chatJid);
    }
    MediaInfo info = rows.get(0);
    if (info.mediaType() == null || info.mediaType().isEmpty()) {
      throw new MediaInfoUnavailableException("message " + messageId + " carries no media");
    }
    return info;
  }

  @Override
  public boolean supports(StoreCapability capability) {
    return true;
  }

  @Override
  public String backendName() {
    return BACKEND;
  }

  @Override
  public void close() {
    // the pooled DataSource is closed by the container
    log.debug("Local message store closed");
  }
}

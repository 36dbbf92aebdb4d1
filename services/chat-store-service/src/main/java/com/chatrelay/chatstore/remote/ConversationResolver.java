package com.chatrelay.chatstore.remote;

import com.chatrelay.chatstore.store.ConversationCreationException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;

/**
 * Maps a contact identifier to its durable conversation id, creating the conversation on first
 * contact.
 *
 * <p>Lookup and create for one contact run under a per-contact lock, so two threads of this
 * process never both observe "absent" and both create. Other processes are only kept out by a
 * unique constraint on {@code (channel, contact_identifier)} in the remote schema: a create
 * rejected with 409 is answered by re-reading the winner's row.
 *
 * <p>The id cache is a hint. {@link #refreshConversation} always asks the store.
 */
@Slf4j
public class ConversationResolver {

  static final String CONVERSATIONS = "conversations";

  private static final DateTimeFormatter RFC_3339 = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

  private final RemoteStoreClient client;
  private final String channel;
  private final Cache<String, String> cache;
  private final LoadingCache<String, ReentrantLock> locks =
      Caffeine.newBuilder().weakValues().build(key -> new ReentrantLock());

  public ConversationResolver(RemoteStoreClient client, String channel, long cacheMaxSize) {
    this.client = client;
    this.channel = channel;
    this.cache = Caffeine.newBuilder().maximumSize(cacheMaxSize).build();
  }

  /** Served from the cache when possible, otherwise looked up or created. */
  public String resolveConversation(String contactIdentifier, String displayName) {
    String cached = cache.getIfPresent(contactIdentifier);
    if (cached != null) {
      return cached;
    }
    ReentrantLock lock = locks.get(contactIdentifier);
    lock.lock();
    try {
      cached = cache.getIfPresent(contactIdentifier);
      if (cached != null) {
        return cached;
      }
      String id = lookupOrCreate(contactIdentifier, displayName);
      cache.put(contactIdentifier, id);
      return id;
    } finally {
      lock.unlock();
    }
  }

  /** Authoritative resolution that bypasses and then refreshes the cache. */
  public String refreshConversation(String contactIdentifier, String displayName) {
    ReentrantLock lock = locks.get(contactIdentifier);
    lock.lock();
    try {
      String id = lookupOrCreate(contactIdentifier, displayName);
      cache.put(contactIdentifier, id);
      return id;
    } finally {
      lock.unlock();
    }
  }

  public Optional<String> cachedConversationId(String contactIdentifier) {
    return Optional.ofNullable(cache.getIfPresent(contactIdentifier));
  }

  public void updateName(String contactIdentifier, String name) {
    String endpoint =
        RemoteQuery.from(CONVERSATIONS)
            .eq("contact_identifier", contactIdentifier)
            .eq("channel", channel)
            .toEndpoint();
    client.execute(HttpMethod.PATCH, endpoint, Map.of("contact_name", name));
  }

  public void updateLastMessageAt(String conversationId, Instant timestamp) {
    if (timestamp == null) {
      throw new IllegalArgumentException("timestamp is required");
    }
    String endpoint = RemoteQuery.from(CONVERSATIONS).eq("id", conversationId).toEndpoint();
    client.execute(
        HttpMethod.PATCH, endpoint, Map.of("last_message_at", formatTimestamp(timestamp)));
  }

  static String formatTimestamp(Instant timestamp) {
    return RFC_3339.format(timestamp.truncatedTo(ChronoUnit.SECONDS).atOffset(ZoneOffset.UTC));
  }

  private String lookupOrCreate(String contactIdentifier, String displayName) {
    Optional<String> existing = lookup(contactIdentifier);
    if (existing.isPresent()) {
      return existing.get();
    }
    try {
      return create(contactIdentifier, displayName);
    } catch (RemoteApiException e) {
      if (e.getStatusCode() != HttpStatus.CONFLICT.value()) {
        throw e;
      }
      log.info("Conversation for {} was created concurrently; re-reading it", contactIdentifier);
      return lookup(contactIdentifier).orElseThrow(() -> e);
    }
  }

  private Optional<String> lookup(String contactIdentifier) {
    String endpoint =
        RemoteQuery.from(CONVERSATIONS)
            .eq("contact_identifier", contactIdentifier)
            .eq("channel", channel)
            .select("id")
            .toEndpoint();
    byte[] response = client.execute(HttpMethod.GET, endpoint, null);
    List<IdRow> rows = client.readRows(response, IdRow.class, "conversation");
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    String id = rows.get(0).id();
    if (id == null || id.isEmpty()) {
      throw new RemoteParseException("conversation row for " + contactIdentifier + " has no id");
    }
    return Optional.of(id);
  }

  private String create(String contactIdentifier, String displayName) {
    ConversationRecord conversation =
        ConversationRecord.newConversation(channel, contactIdentifier, displayName);
    byte[] response = client.execute(HttpMethod.POST, CONVERSATIONS, conversation);
    List<IdRow> rows = client.readRows(response, IdRow.class, "new conversation");
    if (rows.isEmpty() || rows.get(0).id() == null || rows.get(0).id().isEmpty()) {
      throw new ConversationCreationException(
          "no conversation returned after creation for " + contactIdentifier);
    }
    log.info("Created conversation {} for {}", rows.get(0).id(), contactIdentifier);
    return rows.get(0).id();
  }
}

package io.intellixity.docclients.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;

import java.util.Objects;

/** Live Mongo connection held by the registry for one named client. */
public final class MongoConnection {
  private final String id;
  private final MongoClient client;
  private final String database;

  public MongoConnection(String id, MongoClient client, String database) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.database = (database == null || database.isBlank()) ? null : database;
  }

  /** Identifier for logging: {@code mongo:<hosts>[/<database>]}. */
  public String id() { return id; }

  public MongoClient client() { return client; }

  /** Database named in the connection string, or null. */
  public String database() { return database; }

  /** The database named in the connection string. */
  public MongoDatabase defaultDatabase() {
    if (database == null) throw new IllegalStateException("Connection " + id + " has no database in its URI");
    return client.getDatabase(database);
  }

  @Override
  public String toString() {
    return "MongoConnection[" + id + "]";
  }
}

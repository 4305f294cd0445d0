package io.intellixity.polyquery.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import io.intellixity.polyquery.exec.StoreExecutionException;
import io.intellixity.polyquery.plan.FilterQuery;
import io.intellixity.polyquery.plan.StoreKind;
import io.intellixity.polyquery.plan.StoreQuery;
import io.intellixity.polyquery.row.Row;
import io.intellixity.polyquery.spi.AbstractStoreAdapter;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Document adapter using the official MongoDB Java sync driver.\n
 *
 * Each matching document becomes one row; see {@link MongoValues} for value rendering.
 */
public final class MongoStoreAdapter extends AbstractStoreAdapter<MongoHandle> {
  /** Opens a cursor over {@code collection} for {@code filter}. */
  @FunctionalInterface
  interface DocumentFinder {
    MongoCursor<Document> find(String collection, Document filter);
  }

  private final DocumentFinder finder;

  public MongoStoreAdapter(MongoHandle handle) {
    this(handle, finderFor(handle.client().getDatabase(handle.database())));
  }

  MongoStoreAdapter(MongoHandle handle, DocumentFinder finder) {
    super(StoreKind.DOCUMENT, handle);
    this.finder = Objects.requireNonNull(finder, "finder");
  }

  private static DocumentFinder finderFor(MongoDatabase db) {
    return (collection, filter) -> {
      MongoCollection<Document> col = db.getCollection(collection);
      return col.find(filter).iterator();
    };
  }

  @Override
  protected List<Row> doExecute(StoreQuery query) {
    FilterQuery fq = (FilterQuery) query;
    try (MongoCursor<Document> cursor = finder.find(fq.collection(), new Document(fq.predicate()))) {
      List<Row> out = new ArrayList<>();
      while (cursor.hasNext()) out.add(MongoValues.toRow(cursor.next()));
      return out;
    } catch (MongoException e) {
      throw new StoreExecutionException(StoreKind.DOCUMENT, e.getMessage(), e);
    }
  }
}

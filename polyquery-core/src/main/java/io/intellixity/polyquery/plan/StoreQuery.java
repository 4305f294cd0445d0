package io.intellixity.polyquery.plan;

/**
 * Store-specific query carried by a stage.\n
 *
 * - {@link TextQuery}: source text in the relational or graph dialect\n
 * - {@link FilterQuery}: collection name + predicate map for the document store\n
 *
 * Adapters switch on {@link #kind()}.
 */
public sealed interface StoreQuery permits TextQuery, FilterQuery {
  Kind kind();

  enum Kind { TEXT, FILTER }
}

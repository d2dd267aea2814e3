package io.aleph0.fanout.core;

/**
 * Produces the copy of published content that a single subscriber receives. The publisher calls
 * the copier once per matching subscriber.
 *
 * @param <ContentT> the content type
 */
@FunctionalInterface
public interface ContentCopier<ContentT> {
  /**
   * Returns a copier that hands every subscriber the published instance itself. Only appropriate
   * for immutable content.
   */
  public static <ContentT> ContentCopier<ContentT> identity() {
    return content -> content;
  }

  public ContentT copy(ContentT content);
}

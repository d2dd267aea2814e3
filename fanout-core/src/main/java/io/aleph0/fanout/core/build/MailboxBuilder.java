package io.aleph0.fanout.core.build;

import io.aleph0.fanout.core.transport.Mailbox;

@FunctionalInterface
public interface MailboxBuilder<T> {
  public Mailbox<T> build();
}

package com.intteq.fluent.broker.capability;

import com.intteq.fluent.broker.core.Message;

import java.util.List;

/** Destination for dispatched outbox messages moved out by the archiver. */
public interface ArchiveProvider {

    void archive(List<Message> messages);
}

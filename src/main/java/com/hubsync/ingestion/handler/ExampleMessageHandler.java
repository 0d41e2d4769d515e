package com.hubsync.ingestion.handler;

import com.hubsync.domain.Message;
import com.hubsync.domain.MessageState;
import com.hubsync.domain.StoreMessageOperation;
import com.hubsync.ingestion.processor.MessageHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;
import org.springframework.stereotype.Component;

/**
 * Default handler: logs each new message change. Applications replace this bean to materialize their own tables
 * inside the event transaction.
 */
@Component
@Slf4j
public class ExampleMessageHandler implements MessageHandler {

    @Override
    public void handleMessageMerge(Message message,
                                   NamedParameterJdbcOperations txn,
                                   StoreMessageOperation operation,
                                   MessageState state,
                                   boolean isNew,
                                   boolean wasMissed) {
        if (!isNew) {
            return;
        }
        if (wasMissed) {
            log.info("Stored missed {} message {} for fid {} ({})", message.type(), message.hash(), message.fid(), state);
        } else {
            log.debug("{} {} message {} for fid {} ({})", operation, message.type(), message.hash(), message.fid(), state);
        }
    }
}

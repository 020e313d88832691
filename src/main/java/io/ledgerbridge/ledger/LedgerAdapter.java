package io.ledgerbridge.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Engine-facing view of one chain. Implementations own RPC, signing and transaction
 * construction; every method may throw {@link LedgerException}.
 */
public interface LedgerAdapter {

    String name();

    /**
     * Incoming transfers with event time at or after {@code sinceWatermarkMs}. Delivery is
     * at-least-once: the same transaction may be returned on every call.
     */
    List<RawEvent> fetchNewEvents(long sinceWatermarkMs);

    /**
     * Submits one transfer. A returned handle means the ledger accepted the submission, not
     * that it settled.
     */
    TransferHandle submitTransfer(TransferRequest request);

    Confirmation confirm(TransferHandle handle);

    /**
     * Looks up an existing account. Implementations never create accounts.
     */
    Optional<AccountInfo> lookupAccount(String address);

    /**
     * Searches the engine's own recent outgoing transfers for {@code memo}. Only transfers
     * that have not failed on the ledger are returned.
     */
    Optional<TransferHandle> findRecentTransferByMemo(String memo, int searchLimit);

    /**
     * Outgoing transfers of the engine's account since {@code sinceMs}, used to rebuild
     * settlement markers after state loss.
     */
    List<OutgoingTransfer> scanOutgoingTransfers(long sinceMs);
}

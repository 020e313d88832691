package io.ledgerbridge.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.ledgerbridge.config.BridgeConfig;
import io.ledgerbridge.model.ItemKind;
import io.ledgerbridge.model.ItemStatus;
import io.ledgerbridge.model.TerminalTable;
import io.ledgerbridge.observability.AuditLogger;
import io.ledgerbridge.runtime.BridgeStores;
import io.ledgerbridge.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.time.Clock;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Operator CLI. Store-only: it reads and repairs the local database and audit log, while the
 * chain adapters live in the process that embeds {@link io.ledgerbridge.runtime.SettlementRuntime}.
 */
@Command(
        name = "ledgerbridge",
        mixinStandardHelpOptions = true,
        description = "LedgerBridge settlement engine operator CLI",
        subcommands = {
                LedgerBridgeCommand.InitCommand.class,
                LedgerBridgeCommand.StatsCommand.class,
                LedgerBridgeCommand.ItemsCommand.class,
                LedgerBridgeCommand.TerminalCommand.class,
                LedgerBridgeCommand.FeesCommand.class,
                LedgerBridgeCommand.WatermarksCommand.class,
                LedgerBridgeCommand.SweepCommand.class,
                LedgerBridgeCommand.AlertsCommand.class,
                LedgerBridgeCommand.RequeueCommand.class,
                LedgerBridgeCommand.AuditTailCommand.class,
                LedgerBridgeCommand.AuditVerifyCommand.class,
                LedgerBridgeCommand.SchemaMigrationsCommand.class
        }
)
public final class LedgerBridgeCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = BridgeConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | stats | items | terminal | fees | watermarks | sweep | alerts | requeue | audit-tail | audit-verify | schema-migrations");
    }

    BridgeStores stores() {
        BridgeStores stores = BridgeStores.open(BridgeConfig.fromRoot(root), Clock.systemUTC());
        stores.init();
        return stores;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        LedgerBridgeCommand parent;

        @Override
        public Integer call() {
            BridgeStores stores = parent.stores();
            System.out.println("Initialized LedgerBridge at: " + stores.config().rootDir());
            return 0;
        }
    }

    @Command(name = "stats", description = "Item counts per status, live reservations and watermarks")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        LedgerBridgeCommand parent;

        @Override
        public Integer call() {
            BridgeStores stores = parent.stores();
            Map<String, Object> out = new LinkedHashMap<>();
            Map<String, Map<String, Long>> counts = new LinkedHashMap<>();
            for (ItemKind kind : ItemKind.values()) {
                counts.put(kind.label(), stores.items().countsByStatus(kind));
            }
            out.put("items_by_status", counts);
            out.put("live_reservations", stores.reservations().countLive(stores.clock().millis()));
            out.put("watermarks", labelled(stores.watermarks().committed()));
            out.put("stuck_items", stores.stuckItems().size());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "items", description = "List open items, oldest event first")
    static final class ItemsCommand implements Callable<Integer> {
        @ParentCommand
        LedgerBridgeCommand parent;

        @Option(names = {"--kind"}, defaultValue = "deposit", description = "deposit|credit")
        String kind;

        @Option(names = {"--status"}, description = "Optional status filter, e.g. TO_BE_REFUNDED")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            BridgeStores stores = parent.stores();
            Set<ItemStatus> statuses = status == null || status.isBlank()
                    ? EnumSet.allOf(ItemStatus.class)
                    : EnumSet.of(ItemStatus.valueOf(status.trim().toUpperCase()));
            System.out.println(Jsons.toJson(stores.items().listOpen(ItemKind.parse(kind), statuses, limit)));
            return 0;
        }
    }

    @Command(name = "terminal", description = "List settled items of one terminal table, newest first")
    static final class TerminalCommand implements Callable<Integer> {
        @ParentCommand
        LedgerBridgeCommand parent;

        @Option(names = {"--kind"}, defaultValue = "deposit", description = "deposit|credit")
        String kind;

        @Option(names = {"--table"}, defaultValue = "processed", description = "processed|refunded|quarantined")
        String table;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            BridgeStores stores = parent.stores();
            System.out.println(Jsons.toJson(stores.items().listSettled(ItemKind.parse(kind), TerminalTable.parse(table), limit)));
            return 0;
        }
    }

    @Command(name = "fees", description = "Show the fee summary")
    static final class FeesCommand implements Callable<Integer> {
        @ParentCommand
        LedgerBridgeCommand parent;

        @Option(names = {"--rebuild"}, defaultValue = "false", description = "Recompute the summary from the fee ledger first")
        boolean rebuild;

        @Override
        public Integer call() {
            BridgeStores stores = parent.stores();
            if (rebuild) {
                System.out.println(Jsons.toJson(stores.fees().rebuildSummary(stores.clock().millis())));
            } else {
                System.out.println(Jsons.toJson(stores.fees().summary()));
            }
            return 0;
        }
    }

    @Command(name = "watermarks", description = "Committed watermarks and pending proposals")
    static final class WatermarksCommand implements Callable<Integer> {
        @ParentCommand
        LedgerBridgeCommand parent;

        @Override
        public Integer call() {
            BridgeStores stores = parent.stores();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("committed", labelled(stores.watermarks().committed()));
            out.put("proposals", labelled(stores.watermarks().proposals()));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "sweep", description = "Delete expired reservations")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        LedgerBridgeCommand parent;

        @Override
        public Integer call() {
            BridgeStores stores = parent.stores();
            int swept = stores.reservations().sweepExpired(stores.clock().millis());
            System.out.println(Jsons.toJson(Map.of("reservations_swept", swept)));
            return 0;
        }
    }

    @Command(name = "alerts", description = "Items waiting for an operator (QUARANTINE_FAILED, NEEDS_RECONCILIATION)")
    static final class AlertsCommand implements Callable<Integer> {
        @ParentCommand
        LedgerBridgeCommand parent;

        @Override
        public Integer call() {
            List<BridgeStores.StuckItem> stuck = parent.stores().stuckItems();
            System.out.println(Jsons.toJson(stuck));
            return stuck.isEmpty() ? 0 : 2;
        }
    }

    @Command(name = "requeue", description = "Send a QUARANTINE_FAILED item back to the quarantine queue")
    static final class RequeueCommand implements Callable<Integer> {
        @ParentCommand
        LedgerBridgeCommand parent;

        @Option(names = {"--kind"}, required = true, description = "deposit|credit")
        String kind;

        @Option(names = {"--id"}, required = true, description = "Item transaction id")
        String id;

        @Option(names = {"--actor"}, defaultValue = "operator", description = "Actor recorded in the audit log")
        String actor;

        @Override
        public Integer call() {
            BridgeStores.RequeueOutcome out = parent.stores().requeueQuarantine(ItemKind.parse(kind), id, actor);
            System.out.println(Jsons.toJson(out));
            return out.requeued() ? 0 : 1;
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        LedgerBridgeCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            for (JsonNode row : parent.stores().audit().tail(lines)) {
                System.out.println(Jsons.toCompactJson(row));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        LedgerBridgeCommand parent;

        @Override
        public Integer call() {
            AuditLogger.VerifyOutcome out = parent.stores().audit().verify();
            System.out.println(Jsons.toJson(out));
            return out.valid() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        LedgerBridgeCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.stores().database().listSchemaMigrations(limit)));
            return 0;
        }
    }

    private static Map<String, Long> labelled(Map<ItemKind, Long> values) {
        Map<String, Long> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k.label(), v));
        return out;
    }
}

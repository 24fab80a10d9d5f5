package dev.lukebemish.testbench.framework.listener;

import java.io.PrintWriter;
import java.util.List;

public final class SummaryPrinter {
    private SummaryPrinter() {}

    public static void printTo(ExecutionSummary summary, PrintWriter writer) {
        writer.printf("%nTest run finished after %d ms%n", summary.getTimeFinished() - summary.getTimeStarted());
        writer.printf("[%10d containers found      ]%n", summary.getContainersFoundCount());
        writer.printf("[%10d containers skipped    ]%n", summary.getContainersSkippedCount());
        writer.printf("[%10d containers started    ]%n", summary.getContainersStartedCount());
        writer.printf("[%10d containers aborted    ]%n", summary.getContainersAbortedCount());
        writer.printf("[%10d containers successful ]%n", summary.getContainersSucceededCount());
        writer.printf("[%10d containers failed     ]%n", summary.getContainersFailedCount());
        writer.printf("[%10d tests found           ]%n", summary.getTestsFoundCount());
        writer.printf("[%10d tests skipped         ]%n", summary.getTestsSkippedCount());
        writer.printf("[%10d tests started         ]%n", summary.getTestsStartedCount());
        writer.printf("[%10d tests aborted         ]%n", summary.getTestsAbortedCount());
        writer.printf("[%10d tests successful      ]%n", summary.getTestsSucceededCount());
        writer.printf("[%10d tests failed          ]%n", summary.getTestsFailedCount());
        writer.flush();
    }

    public static void printFailuresTo(ExecutionSummary summary, PrintWriter writer) {
        List<ExecutionSummary.Failure> failures = summary.getFailures();
        if (failures.isEmpty()) {
            return;
        }
        writer.printf("%nFailures (%d):%n", failures.size());
        for (var failure : failures) {
            writer.printf("  %s%n", failure.nodeId());
            writer.printf("    => %s: %s%n", failure.cause().kind(), failure.cause().message());
        }
        writer.flush();
    }
}

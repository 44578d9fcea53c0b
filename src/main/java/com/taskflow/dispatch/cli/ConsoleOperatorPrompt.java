package com.taskflow.dispatch.cli;

import com.taskflow.core.dispatch.workers.TaskBrief;
import com.taskflow.core.engine.OperatorDecision;
import com.taskflow.core.engine.OperatorPrompt;
import com.taskflow.core.model.GateId;
import com.taskflow.core.model.TaskSnapshot;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Asks for operator sign-off on the terminal. Blocks until an answer is typed; end of input
 * defers the gate.
 */
@Component
public class ConsoleOperatorPrompt implements OperatorPrompt {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleOperatorPrompt() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    ConsoleOperatorPrompt(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public OperatorDecision confirm(TaskSnapshot task, GateId gate) {
        out.println();
        out.println(TaskBrief.render(task));
        out.println(ConsoleOutput.RULE);
        while (true) {
            out.print("Approve " + gate.key() + " for " + task.id() + "? [y]es / [n]o / [d]efer: ");
            out.flush();
            String answer = readLine();
            if (answer == null) {
                return OperatorDecision.defer();
            }
            switch (answer.trim().toLowerCase()) {
                case "y", "yes" -> {
                    return OperatorDecision.approve();
                }
                case "d", "defer" -> {
                    return OperatorDecision.defer();
                }
                case "n", "no" -> {
                    out.print("What needs to change? ");
                    out.flush();
                    String reason = readLine();
                    return OperatorDecision.revise(reason == null || reason.isBlank() ? "revision requested" : reason.trim());
                }
                default -> out.println("Please answer y, n or d.");
            }
        }
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read operator answer", e);
        }
    }
}

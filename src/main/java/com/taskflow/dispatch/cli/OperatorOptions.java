package com.taskflow.dispatch.cli;

import picocli.CommandLine.Option;

/**
 * Identity recorded on confirmations, blocks and changelog entries.
 */
public class OperatorOptions {

    @Option(names = {"--as"}, description = "Operator identity (default: ${DEFAULT-VALUE})",
            defaultValue = "${sys:user.name}")
    String identity;

    public String identity() {
        return identity == null || identity.isBlank() ? "operator" : identity;
    }
}

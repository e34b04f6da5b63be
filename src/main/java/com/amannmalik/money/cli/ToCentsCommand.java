package com.amannmalik.money.cli;

import com.amannmalik.money.api.Money;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "to-cents", description = "Print an amount in minor units")
public final class ToCentsCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;
    @CommandLine.Option(names = "--currency", required = true, description = "ISO-4217 currency code, e.g. USD")
    String currency;
    @CommandLine.Parameters(index = "0", paramLabel = "AMOUNT", description = "Decimal amount")
    String amount;

    public ToCentsCommand() {
    }

    @Override
    public Integer call() {
        spec.commandLine().getOut().println(Money.create(amount, currency).toCents());
        return 0;
    }
}

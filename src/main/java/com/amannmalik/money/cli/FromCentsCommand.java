package com.amannmalik.money.cli;

import com.amannmalik.money.api.CurrencyCode;
import com.amannmalik.money.api.Money;
import com.amannmalik.money.codec.MoneyJsonCodec;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "from-cents", description = "Convert minor units to an amount and print it as JSON")
public final class FromCentsCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;
    @CommandLine.Option(names = "--currency", required = true, description = "ISO-4217 currency code, e.g. USD")
    String currency;
    @CommandLine.Parameters(index = "0", paramLabel = "CENTS", description = "Whole number of minor units")
    long cents;

    public FromCentsCommand() {
    }

    @Override
    public Integer call() {
        var money = Money.fromCents(cents, CurrencyCode.parse(currency));
        spec.commandLine().getOut().println(new MoneyJsonCodec().writeString(money));
        return 0;
    }
}

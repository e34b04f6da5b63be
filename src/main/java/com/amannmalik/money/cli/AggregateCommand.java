package com.amannmalik.money.cli;

import com.amannmalik.money.api.CurrencyCode;
import com.amannmalik.money.api.Money;
import com.amannmalik.money.codec.MoneyJsonCodec;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(description = "Aggregate amounts of a single currency and print the result as JSON")
public final class AggregateCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;
    @CommandLine.Option(names = "--currency", required = true, description = "ISO-4217 currency code, e.g. USD")
    String currency;
    @CommandLine.Parameters(arity = "1..*", paramLabel = "AMOUNT", description = "Decimal amounts")
    List<String> amounts;

    private final Kind kind;

    public AggregateCommand(Kind kind) {
        this.kind = kind;
    }

    @Override
    public Integer call() {
        var code = CurrencyCode.parse(currency);
        var values = amounts.stream().map(amount -> Money.create(amount, code)).toList();
        var result = switch (kind) {
            case SUM -> Money.sum(values);
            case MIN -> Money.min(values);
            case MAX -> Money.max(values);
        };
        spec.commandLine().getOut().println(new MoneyJsonCodec().writeString(result));
        return 0;
    }

    public enum Kind {
        SUM,
        MIN,
        MAX
    }
}

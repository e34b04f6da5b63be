package com.amannmalik.money.cli;

import com.amannmalik.money.api.Money;
import com.amannmalik.money.codec.MoneyJsonCodec;
import com.amannmalik.money.decimal.DecimalContext;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "round", description = "Round an amount, optionally after scaling it, and print the result as JSON")
public final class RoundCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;
    @CommandLine.Option(names = "--currency", required = true, description = "ISO-4217 currency code, e.g. USD")
    String currency;
    @CommandLine.Option(names = "--scale", description = "Fractional digits to keep (default: --default-scale)")
    Integer scale;
    @CommandLine.Option(names = "--multiply", description = "Multiply before rounding")
    Double multiplier;
    @CommandLine.Option(names = "--divide", description = "Divide before rounding")
    Double divisor;
    @CommandLine.Parameters(index = "0", paramLabel = "AMOUNT", description = "Decimal amount")
    String amount;

    public RoundCommand() {
    }

    @Override
    public Integer call() {
        if (multiplier != null && divisor != null) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--multiply and --divide are mutually exclusive");
        }
        var money = Money.create(amount, currency);
        var effectiveScale = scale != null ? scale : DecimalContext.current().defaultScale();
        Money result;
        if (multiplier != null) {
            result = money.multiplyThenRound(multiplier, effectiveScale);
        } else if (divisor != null) {
            result = money.divideThenRound(divisor, effectiveScale);
        } else {
            result = money.round(effectiveScale);
        }
        spec.commandLine().getOut().println(new MoneyJsonCodec().writeString(result));
        return 0;
    }
}

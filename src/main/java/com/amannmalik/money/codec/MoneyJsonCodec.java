package com.amannmalik.money.codec;

import com.amannmalik.money.api.CurrencyCode;
import com.amannmalik.money.api.Money;
import com.amannmalik.money.api.MoneyTransfer;
import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.json.JsonValue;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the {@code {"amount": "...", "currency": "..."}} transfer record. Decoding is strict:
 * the amount MUST be a plain decimal literal and the currency MUST be recognized.
 */
public final class MoneyJsonCodec {
    private static final String AMOUNT = "amount";
    private static final String CURRENCY = "currency";

    public MoneyTransfer readTransfer(InputStream body) {
        return readTransfer(JsonSupport.requireObject(JsonSupport.read(Json.createReader(body)), "$"));
    }

    public MoneyTransfer readTransfer(JsonObject object) {
        var amount = JsonSupport.requireMatching(object, AMOUNT, MoneyTransfer.AMOUNT);
        var currency = JsonSupport.requireString(object, CURRENCY);
        if (!CurrencyCode.isRecognized(currency)) {
            throw new JsonDecodingException("Unrecognized currency: " + currency);
        }
        return new MoneyTransfer(amount, currency);
    }

    public Money readMoney(InputStream body) {
        return Money.fromRecord(readTransfer(body));
    }

    public List<Money> readMoneyList(InputStream body) {
        var root = JsonSupport.read(Json.createReader(body));
        if (root.getValueType() != JsonValue.ValueType.ARRAY) {
            throw new JsonDecodingException("Expected array at: $");
        }
        var array = root.asJsonArray();
        var result = new ArrayList<Money>(array.size());
        for (int i = 0; i < array.size(); i++) {
            var object = JsonSupport.requireObject(array.get(i), "$[" + i + "]");
            result.add(Money.fromRecord(readTransfer(object)));
        }
        return List.copyOf(result);
    }

    public JsonObject toJson(Money money) {
        var record = money.toRecord();
        return Json.createObjectBuilder()
                .add(AMOUNT, record.amount())
                .add(CURRENCY, record.currency())
                .build();
    }

    public String writeString(Money money) {
        return toJson(money).toString();
    }

    public void write(OutputStream outputStream, Money money) {
        try (Writer writer = new OutputStreamWriter(outputStream, StandardCharsets.UTF_8)) {
            Json.createWriter(writer).write(toJson(money));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package com.acme.render.web;

import com.acme.render.core.Jsons;
import com.acme.render.spi.CreditLedger;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.Map;
import java.util.UUID;

@Controller("/users")
@ExecuteOn(TaskExecutors.BLOCKING)
public class CreditController {
    private final CreditLedger ledger;

    public CreditController(CreditLedger ledger) {
        this.ledger = ledger;
    }

    @Get("/{id}/credits")
    public HttpResponse<?> credits(@PathVariable UUID id) {
        return HttpResponse.ok(Jsons.toJson(Map.of("userId", id.toString(), "balance", ledger.balance(id))));
    }
}

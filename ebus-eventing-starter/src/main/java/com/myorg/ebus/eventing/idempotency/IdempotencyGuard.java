package com.myorg.ebus.eventing.idempotency;

import com.myorg.ebus.eventing.EbusEventingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
//Startup check: store=auto that fell back to memory only deduplicates inside
// one instance. Warn in dev, fail in prod or when requireRedis=true.
@Slf4j
@RequiredArgsConstructor
public class IdempotencyGuard implements ApplicationListener<ApplicationReadyEvent> {
    private final EbusEventingProperties props;
    private final Environment env;
    private final ObjectProvider<IdempotencyCache> cacheProvider;

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        var idem = props.getIdempotency();
        if (!idem.isActive()) return;

        String store = idem.getStore() == null ? "auto" : idem.getStore().toLowerCase();
        if (!"auto".equals(store)) return;
        if (!(cacheProvider.getIfAvailable() instanceof InMemoryIdempotencyCache)) return;

        boolean isProd = false;
        for (String p : env.getActiveProfiles()) {
            if ("prod".equalsIgnoreCase(p) || "production".equalsIgnoreCase(p)) {
                isProd = true;
                break;
            }
        }

        String msg = "Idempotency store=auto but no Redis found -> in-memory cache (dedup within one instance only).";
        if (idem.isRequireRedis() || isProd) {
            throw new IllegalStateException(msg + " (prod/requireRedis => fail startup)");
        }
        log.warn(msg + " (dev => warn)");
    }
}

package com.qcache.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * {@code application.properties} içindeki "app" önekli değerleri tip güvenli
 * biçimde okuyan yapılandırma arayüzüdür. Önbelleğin tahliye disiplini, toplam
 * boyutu ve 2Q havuz oranları buradan gelir.
 */
@ConfigMapping(prefix = "app")
public interface AppProperties
{
    Cache cache();

    interface Cache {
        @WithDefault("TWO_QUEUE")
        String policy();

        @WithDefault("1024")
        int size();

        @WithDefault("0.25")
        double recentRatio();

        @WithDefault("0.50")
        double ghostRatio();
    }
}

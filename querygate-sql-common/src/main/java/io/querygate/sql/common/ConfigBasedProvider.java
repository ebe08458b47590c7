package io.querygate.sql.common;

import com.typesafe.config.Config;

/**
 * Implementations are selected through a config block carrying a {@code class} key.
 * The class either exposes a constructor taking the block's {@link Config} or a no-arg
 * constructor followed by {@link #setConfig(Config)}.
 */
public interface ConfigBasedProvider {

    String CLASS_KEY = "class";
    Class<?>[] constructorParameterTypes = {Config.class};

    static <T extends ConfigBasedProvider> T load(Config config, String prefixKey, T defaultObject) throws Exception {
        if (!config.hasPath(prefixKey)) {
            return defaultObject;
        }
        var innerConfig = config.getConfig(prefixKey);
        if (!innerConfig.hasPath(CLASS_KEY)) {
            defaultObject.setConfig(innerConfig);
            return defaultObject;
        }
        return instantiate(innerConfig);
    }

    @SuppressWarnings("unchecked")
    private static <T extends ConfigBasedProvider> T instantiate(Config innerConfig) throws Exception {
        var clazz = innerConfig.getString(CLASS_KEY);
        var c = Class.forName(clazz);
        try {
            var constructorWithConfig = c.getConstructor(constructorParameterTypes);
            return (T) constructorWithConfig.newInstance(innerConfig);
        } catch (NoSuchMethodException e) {
            var object = (T) c.getConstructor().newInstance();
            object.setConfig(innerConfig);
            return object;
        }
    }

    void setConfig(Config config);
}

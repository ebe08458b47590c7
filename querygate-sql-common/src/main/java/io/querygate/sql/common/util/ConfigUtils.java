package io.querygate.sql.common.util;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.List;

import static io.querygate.sql.common.ConfigConstants.CONFIG_PATH;

public class ConfigUtils {

    public record ConfigWithMainParameters(Config config, List<String> mainParameters){}

    public static ConfigWithMainParameters loadCommandLineConfig(String[] args) {
        var argv = new Args();
        JCommander.newBuilder()
                .addObject(argv)
                .build()
                .parse(args);
        var buffer = new StringBuilder();
        if(argv.configs != null) {
            argv.configs.forEach(c -> {
                buffer.append(c);
                buffer.append("\n");
            });
        }
        var mainParameters = argv.mainParameters == null ? List.<String>of() : List.copyOf(argv.mainParameters);
        return new ConfigWithMainParameters(ConfigFactory.parseString(buffer.toString()), mainParameters);
    }

    /**
     * Command line overrides layered over {@code application.conf} and every
     * {@code reference.conf} on the classpath, scoped to the {@code querygate} block.
     */
    public static Config loadAppConfig(Config commandLineConfig) {
        return commandLineConfig.withFallback(ConfigFactory.load()).getConfig(CONFIG_PATH);
    }

    public static class Args {
        @Parameter(names = {"--conf"}, description = "Configurations" )
        private List<String> configs;

        @Parameter
        private List<String>  mainParameters;
    }
}

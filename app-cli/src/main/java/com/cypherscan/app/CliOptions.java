package com.cypherscan.app;

import java.nio.file.Path;
import java.time.Duration;

/** 명령행 인자. 토큰은 --token 또는 환경변수 GITHUB_TOKEN. */
public record CliOptions(String repository,
                         String path,
                         String contractAddress,
                         String chain,
                         String token,
                         Path config,
                         Path outDir,
                         Duration waitLimit) {

    static final String USAGE = """
            usage: cypherscan --repo owner/name [--path dir/or/file.sol] [--token TOKEN]
                   cypherscan --address 0x... --chain ethereum
                   options: [--config scan.yml] [--out out] [--wait-minutes 15]""";

    public static CliOptions parse(String[] args, String envToken) {
        String repo = null, path = null, address = null, chain = null, token = null;
        Path config = null;
        Path out = Path.of("out");
        Duration wait = Duration.ofMinutes(15);

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--repo" -> repo = value(args, ++i, a);
                case "--path" -> path = value(args, ++i, a);
                case "--address" -> address = value(args, ++i, a);
                case "--chain" -> chain = value(args, ++i, a);
                case "--token" -> token = value(args, ++i, a);
                case "--config" -> config = Path.of(value(args, ++i, a));
                case "--out" -> out = Path.of(value(args, ++i, a));
                case "--wait-minutes" -> {
                    String v = value(args, ++i, a);
                    try {
                        wait = Duration.ofMinutes(Long.parseLong(v));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("--wait-minutes expects a number: " + v);
                    }
                }
                default -> throw new IllegalArgumentException("unknown argument: " + a);
            }
        }
        if (repo == null && address == null) {
            throw new IllegalArgumentException("either --repo or --address is required");
        }
        if (repo != null && address != null) {
            throw new IllegalArgumentException("--repo and --address are mutually exclusive");
        }
        if (token == null && envToken != null && !envToken.isBlank()) token = envToken;
        return new CliOptions(repo, path, address, chain, token, config, out, wait);
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) throw new IllegalArgumentException(flag + " requires a value");
        return args[i];
    }

    public boolean isOnChain() { return contractAddress != null; }
}

package org.coinsetj.tools;

import org.coinsetj.contract.Contract;
import org.coinsetj.core.Address;
import org.coinsetj.core.AddressFormatException;
import org.coinsetj.core.Bytes32;
import org.coinsetj.core.Coin;
import org.coinsetj.core.CoinsetVersion;
import org.coinsetj.core.NetworkParameters;
import org.coinsetj.network.Network;
import org.coinsetj.params.SimNetParams;
import org.coinsetj.params.UnitTestParams;
import org.coinsetj.script.Puzzles;
import org.coinsetj.wallet.InsufficientFundsException;
import org.coinsetj.wallet.SpendableCoin;
import org.coinsetj.wallet.Wallet;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Command line entry point.
 *
 * <pre>
 * version
 * encode &lt;puzzle_hash&gt; [--prefix xch]
 * decode &lt;address&gt;
 * demo [--network simnet|unittest]
 * </pre>
 */
public class CoinsetTool {
    private static final Logger log = LoggerFactory.getLogger(CoinsetTool.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printUsage(err);
            return EXIT_USAGE;
        }
        try {
            switch (args[0]) {
                case "version":
                    out.println(CoinsetVersion.LIBRARY_SUBVER);
                    return EXIT_OK;
                case "encode":
                    return encode(args, out, err);
                case "decode":
                    return decode(args, out, err);
                case "demo":
                    return demo(args, out, err);
                default:
                    err.println("Unknown command: " + args[0]);
                    printUsage(err);
                    return EXIT_USAGE;
            }
        } catch (IllegalArgumentException x) {
            err.println("Failed: " + x.getMessage());
            return EXIT_FAILED;
        }
    }

    private static int encode(String[] args, PrintStream out, PrintStream err) {
        String prefix = SimNetParams.get().getAddressPrefix();
        String puzzleHash = null;
        for (int i = 1; i < args.length; i++) {
            if ("--prefix".equals(args[i]) && i + 1 < args.length) {
                prefix = args[++i];
            } else if (puzzleHash == null) {
                puzzleHash = args[i];
            } else {
                err.println("Unexpected argument: " + args[i]);
                return EXIT_USAGE;
            }
        }
        if (puzzleHash == null) {
            err.println("encode needs a puzzle hash");
            return EXIT_USAGE;
        }
        out.println(Address.encodePuzzleHash(Bytes32.wrap(puzzleHash), prefix));
        return EXIT_OK;
    }

    private static int decode(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 2) {
            err.println("decode needs exactly one address");
            return EXIT_USAGE;
        }
        try {
            out.println(Address.decodePuzzleHash(args[1]));
            return EXIT_OK;
        } catch (AddressFormatException x) {
            err.println("Invalid address: " + x.getMessage());
            return EXIT_FAILED;
        }
    }

    private static int demo(String[] args, PrintStream out, PrintStream err) {
        NetworkParameters params = SimNetParams.get();
        if (args.length == 3 && "--network".equals(args[1])) {
            if ("unittest".equals(args[2])) {
                params = UnitTestParams.get();
            } else if (!"simnet".equals(args[2])) {
                err.println("Unknown network: " + args[2]);
                return EXIT_USAGE;
            }
        } else if (args.length != 1) {
            printUsage(err);
            return EXIT_USAGE;
        }
        try (Network network = Network.create(params)) {
            out.println(runDemo(network).toString(2));
            return EXIT_OK;
        } catch (InsufficientFundsException x) {
            log.error("Demo ran out of funds", x);
            err.println("Failed: " + x.getMessage());
            return EXIT_FAILED;
        }
    }

    /**
     * Farms two blocks to alice, has her combine coins for a larger amount, launch an open contract and pay bob,
     * then describes the resulting state.
     */
    static JSONObject runDemo(Network network) throws InsufficientFundsException {
        NetworkParameters params = network.getParams();
        Wallet alice = network.makeWallet("alice");
        Wallet bob = network.makeWallet("bob");
        network.farmBlock(alice);
        network.farmBlock(alice);

        long blockReward = params.getPoolReward() + params.getFarmerReward();
        SpendableCoin combined = alice.chooseCoin(blockReward + blockReward / 2);
        Contract contract = new Contract(params, Puzzles.openPuzzle("demo".getBytes(StandardCharsets.UTF_8)));
        SpendableCoin contractCoin = alice.launchContract(contract, params.getFarmerReward() / 10);
        SpendableCoin paid = alice.giveChia(bob, params.getFarmerReward());

        JSONObject result = new JSONObject();
        result.put("network", params.getId());
        result.put("height", network.getHeight());
        result.put("timestamp", network.getTimestamp().getSeconds());
        result.put("combined", combined == null ? JSONObject.NULL : toJson(combined.getCoin()));
        result.put("contract", contractCoin == null ? JSONObject.NULL : toJson(contractCoin.getCoin()));
        result.put("payment", paid == null ? JSONObject.NULL : toJson(paid.getCoin()));
        JSONArray wallets = new JSONArray();
        for (Wallet wallet : network.getWallets()) {
            JSONObject json = new JSONObject();
            json.put("name", wallet.getName());
            json.put("address", Address.fromPuzzleHash(params, wallet.getPuzzleHash()).toString());
            json.put("balance", wallet.getBalance());
            JSONArray coins = new JSONArray();
            for (Coin coin : wallet.getCoins()) {
                coins.put(toJson(coin));
            }
            json.put("coins", coins);
            wallets.put(json);
        }
        result.put("wallets", wallets);
        return result;
    }

    private static JSONObject toJson(Coin coin) {
        JSONObject json = new JSONObject();
        json.put("name", coin.getName().toString());
        json.put("parent", coin.getParentCoinInfo().toString());
        json.put("puzzleHash", coin.getPuzzleHash().toString());
        json.put("amount", coin.getAmount());
        return json;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: CoinsetTool <command> [args]");
        err.println("  version");
        err.println("  encode <puzzle_hash> [--prefix xch]");
        err.println("  decode <address>");
        err.println("  demo [--network simnet|unittest]");
    }
}

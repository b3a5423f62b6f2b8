package io.instiflow.institutional;

import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI that captures institutional trading flow for the trailing days into per-security CSV files.
 */
@CommandLine.Command(name = "institutional-flow", mixinStandardHelpOptions = true,
        description = "Download TWSE/TPEx institutional investor flow into per-security CSVs")
public final class InstitutionalFlowMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(InstitutionalFlowMain.class);
    static final ZoneId MARKET_ZONE = ZoneId.of("Asia/Taipei");

    @CommandLine.Option(names = {"-d", "--days"}, description = "Calendar days to fetch, counting back from today", defaultValue = "1")
    int days;

    @CommandLine.Option(names = {"-o", "--data-dir"}, description = "Output directory (default: instiflow.dataDir or data)")
    Path dataDir;

    @CommandLine.Option(names = {"-l", "--stock-list"}, description = "Tracked-security list (default: instiflow.stockList or stock_list.csv)")
    Path stockList;

    @CommandLine.Option(names = {"-w", "--workers"}, description = "Dates processed in parallel")
    Integer workers;

    public static void main(String[] args) {
        int code = new CommandLine(new InstitutionalFlowMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        if (days < 1) {
            System.err.println("--days must be at least 1");
            return 2;
        }
        InstitutionalConfig config;
        List<TrackedSecurity> securities;
        try {
            config = InstitutionalConfig.fromEnv().withOverrides(dataDir, stockList, workers);
            securities = new SecurityListLoader().load(config.stockList());
        } catch (ConfigurationException | IllegalArgumentException e) {
            log.error("Cannot start: {}", e.getMessage());
            return 2;
        }

        Injector injector = Guice.createInjector(new InstitutionalDataModule(config, securities));
        InstitutionalFlowRunner runner = injector.getInstance(InstitutionalFlowRunner.class);
        List<LocalDate> dates = TargetDateSource.trailingDays(LocalDate.now(MARKET_ZONE), days);

        RunSummary summary = runner.run(dates);
        summary.print(System.out);
        log.info("Finished {} dates, data in {}", dates.size(), config.dataDir().toAbsolutePath());
        return 0;
    }
}

package io.replicapacker.cli;

import io.replicapacker.allocation.SearchResult;
import io.replicapacker.config.PackerConfig;
import io.replicapacker.io.PlanReportFormatter;
import io.replicapacker.io.PlanWriter;
import io.replicapacker.io.ServiceCsvLoader;
import io.replicapacker.models.Plan;
import io.replicapacker.models.Replica;
import io.replicapacker.models.ResourceVector;
import io.replicapacker.models.ServiceDemand;
import io.replicapacker.planning.PlanManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static io.replicapacker.config.Constants.*;

/**
 * Batch mode: pack the services of a CSV file, print the report and write the plan file.
 * 
 * Usage:
 * --csv=services.csv --cores=10.68 --ram=21.28 --net=760 --disk-io=380 --storage=1520
 * [--seed=42] [--sample-budget=100] [--output=plan_asignacion.json]
 * 
 * Does nothing when --csv is absent, leaving the REST API as the only entry point.
 */
@Slf4j
public class PlanCommandRunner implements ApplicationRunner {
    
    private final PlanManager planManager;
    private final PackerConfig config;
    private final ServiceCsvLoader csvLoader;
    private final PlanWriter planWriter;
    private final PlanReportFormatter reportFormatter;
    private final PrintStream out;
    
    public PlanCommandRunner(PlanManager planManager, PackerConfig config) {
        this(planManager, config, new ServiceCsvLoader(), new PlanWriter(), new PlanReportFormatter(), System.out);
    }
    
    PlanCommandRunner(PlanManager planManager, PackerConfig config, ServiceCsvLoader csvLoader,
                      PlanWriter planWriter, PlanReportFormatter reportFormatter, PrintStream out) {
        this.planManager = planManager;
        this.config = config;
        this.csvLoader = csvLoader;
        this.planWriter = planWriter;
        this.reportFormatter = reportFormatter;
        this.out = out;
    }
    
    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (!args.containsOption(OPTION_CSV)) {
            log.debug("No --{} option given, skipping batch planning", OPTION_CSV);
            return;
        }
        
        Path csvPath = Paths.get(requiredOption(args, OPTION_CSV));
        ResourceVector capacity = ResourceVector.of(
            requiredNumber(args, OPTION_CORES),
            requiredNumber(args, OPTION_RAM),
            requiredNumber(args, OPTION_NET),
            requiredNumber(args, OPTION_DISK_IO),
            requiredNumber(args, OPTION_STORAGE));
        Long seed = optionalOption(args, OPTION_SEED) != null ? Long.valueOf(optionalOption(args, OPTION_SEED)) : null;
        Integer sampleBudget = optionalOption(args, OPTION_SAMPLE_BUDGET) != null 
            ? Integer.valueOf(optionalOption(args, OPTION_SAMPLE_BUDGET)) : null;
        Path outputPath = Paths.get(optionalOption(args, OPTION_OUTPUT) != null 
            ? optionalOption(args, OPTION_OUTPUT) : config.getOutputFile());
        
        List<ServiceDemand> services = csvLoader.load(csvPath);
        List<Replica> replicas = ServiceDemand.expandAll(services);
        
        SearchResult result = planManager.createPlan(replicas, capacity, seed, sampleBudget);
        Plan plan = result.getBestPlan();
        
        out.println(reportFormatter.format(plan));
        planWriter.write(plan, outputPath);
        out.println();
        out.println("Plan written to " + outputPath);
    }
    
    private static String requiredOption(ApplicationArguments args, String name) {
        String value = optionalOption(args, name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required option --" + name);
        }
        return value;
    }
    
    private static double requiredNumber(ApplicationArguments args, String name) {
        String value = requiredOption(args, name);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option --" + name + " must be a number, got '" + value + "'", e);
        }
    }
    
    private static String optionalOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }
}

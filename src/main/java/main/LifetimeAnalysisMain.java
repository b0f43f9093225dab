package main;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import util.print.CFGWriter;
import analysis.lifetime.LifetimeAnalysis;
import analysis.lifetime.LifetimeResults;
import analysis.lifetime.ir.FunctionBody;
import analysis.lifetime.ir.MalformedBodyException;
import analysis.lifetime.serialization.FunctionBodyReader;
import analysis.lifetime.serialization.JSONUtil;

import com.beust.jcommander.ParameterException;

/**
 * Run the lifetime analysis on the functions in a JSON file, see usage
 */
public class LifetimeAnalysisMain {

    /**
     * Run the lifetime analysis
     *
     * @param args
     *            options and parameters see useage (pass in "-h") for details
     * @throws IOException
     *             file reading or writing issues
     * @throws JSONException
     *             issues reading or writing JSON
     */
    public static void main(String[] args) throws IOException, JSONException {
        LifetimeAnalysisOptions options;
        try {
            options = LifetimeAnalysisOptions.getOptions(args);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.err.println(LifetimeAnalysisOptions.getUseage());
            return;
        }
        if (options.shouldPrintUseage() || options.getInputFile() == null) {
            System.err.println(LifetimeAnalysisOptions.getUseage());
            return;
        }

        int outputLevel = options.getOutputLevel();
        LifetimeAnalysis analysis = new LifetimeAnalysis(options.getTraversalPolicy(), options.getCalleeClassifier());
        analysis.setOutputLevel(outputLevel);

        long start = System.currentTimeMillis();
        List<FunctionBody> bodies = new ArrayList<>();
        List<LifetimeResults> results = analyzeFile(options.getInputFile(), analysis, options.getNumThreads(),
                                                    bodies);

        File dir = new File(options.getOutputDir());
        if (!dir.isDirectory() && !dir.mkdirs()) {
            throw new IOException("Could not create output directory " + dir);
        }
        String name = new File(options.getInputFile()).getName().replaceAll("\\.json$", "");
        String reportFile = dir.getPath() + File.separator + "lifetime_" + name + ".json";
        try (Writer out = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(reportFile),
                                                                        StandardCharsets.UTF_8))) {
            out.write(toJSON(options.getInputFile(), results).toString(2));
        }
        System.err.println("JSON written to: " + reportFile);

        if (options.shouldWriteDot()) {
            for (int i = 0; i < results.size(); i++) {
                if (results.get(i).isFailed()) {
                    continue;
                }
                CFGWriter.writeToFile(bodies.get(i), results.get(i).getBlocksWithFindings(), dir.getPath(), i);
            }
        }

        int findings = 0;
        int failed = 0;
        for (LifetimeResults r : results) {
            findings += r.getDistinctFindings().size();
            failed += r.isFailed() ? 1 : 0;
        }
        System.err.println(results.size() + " functions, " + findings + " findings, " + failed + " failed, in "
                + (System.currentTimeMillis() - start) + "ms");
    }

    /**
     * Read and analyze every function in a file. A function that cannot be decoded or is malformed gets failed
     * results; the others are analyzed normally.
     *
     * @param inputFile
     *            JSON file with the function bodies
     * @param analysis
     *            analysis to run
     * @param numThreads
     *            number of threads to use
     * @param decoded
     *            for each function in the file the decoded body, or null if it could not be decoded, is added to
     *            this list
     * @return one result per function in the file, in file order
     * @throws IOException
     *             file reading issues
     * @throws JSONException
     *             if the file is not a valid JSON document
     */
    public static List<LifetimeResults> analyzeFile(String inputFile, LifetimeAnalysis analysis, int numThreads,
                                                    List<FunctionBody> decoded) throws IOException, JSONException {
        List<JSONObject> fns;
        try (Reader in = new BufferedReader(new InputStreamReader(new FileInputStream(inputFile),
                                                                       StandardCharsets.UTF_8))) {
            fns = FunctionBodyReader.readFunctionObjects(in);
        }

        // null entries mark functions that could not be decoded
        List<FunctionBody> bodies = new ArrayList<>(fns.size());
        List<LifetimeResults> decodeFailures = new ArrayList<>(fns.size());
        for (int i = 0; i < fns.size(); i++) {
            try {
                bodies.add(FunctionBodyReader.readFunction(fns.get(i)));
                decodeFailures.add(null);
            } catch (MalformedBodyException e) {
                System.err.println("Could not decode " + FunctionBodyReader.functionName(fns.get(i), i) + ": "
                        + e.getMessage());
                bodies.add(null);
                decodeFailures.add(LifetimeResults.failed(FunctionBodyReader.functionName(fns.get(i), i),
                                                          e.getMessage()));
            }
        }

        List<FunctionBody> toAnalyze = new ArrayList<>();
        for (FunctionBody b : bodies) {
            if (b != null) {
                toAnalyze.add(b);
            }
        }
        Iterator<LifetimeResults> analyzed = analysis.analyzeAll(toAnalyze, numThreads).iterator();
        List<LifetimeResults> results = new ArrayList<>(fns.size());
        for (int i = 0; i < fns.size(); i++) {
            results.add(bodies.get(i) == null ? decodeFailures.get(i) : analyzed.next());
        }
        decoded.addAll(bodies);
        return results;
    }

    /**
     * Report for all functions of an input file
     *
     * @param inputFile
     *            name of the analyzed file
     * @param results
     *            results in file order
     * @return JSON report
     */
    public static JSONObject toJSON(String inputFile, List<LifetimeResults> results) {
        JSONObject json = new JSONObject();
        JSONUtil.addJSON(json, "input", inputFile);
        JSONArray fns = new JSONArray();
        int findings = 0;
        int failed = 0;
        for (LifetimeResults r : results) {
            fns.put(r.toJSON());
            findings += r.getDistinctFindings().size();
            failed += r.isFailed() ? 1 : 0;
        }
        try {
            json.put("functions", fns);
        } catch (JSONException e) {
            System.err.println("Serialization error for " + inputFile + ", message: " + e.getMessage());
        }
        JSONObject summary = new JSONObject();
        JSONUtil.addJSON(summary, "functions", results.size());
        JSONUtil.addJSON(summary, "findings", findings);
        JSONUtil.addJSON(summary, "failed", failed);
        try {
            json.put("summary", summary);
        } catch (JSONException e) {
            System.err.println("Serialization error for " + inputFile + ", message: " + e.getMessage());
        }
        return json;
    }
}

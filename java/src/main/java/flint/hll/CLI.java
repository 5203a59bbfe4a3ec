/**
 * FlintHLL Command Line Interface
 * Reads values, estimates their cardinality and prints the PipelineDB bytes.
 */
package flint.hll;

import java.io.FileInputStream;
import java.io.InputStream;
import java.io.PrintStream;

public final class CLI {
    private static final String VERSION = "0.0.1";
    
    static boolean LOG = false;

    public static void main(String[] args) {
        try {
            int result = executeCLI(System.out, System.in, args);
            if (result < 0) {
                System.exit(1);
            }
        } catch (HllException e) {
            System.err.println("Error (" + e.getErrorCode() + "): " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (LOG) {
                e.printStackTrace();
            }
            System.exit(1);
        }
    }

    static int executeCLI(PrintStream out, InputStream in, String[] args) throws Exception {
        String file = null;
        String config = null;
        String format = "hex";
        int precision = 14;
        Boolean dense = null;
        Boolean dirty = null;
        Integer maxExplicit = null;
        boolean status = false;

        for (int i = 0; i < args.length; i++) {
            String s = args[i];
            if ("-help".equals(s)) {
                usage(out);
                return 0;
            } else if ("-version".equals(s)) {
                out.println(Options.PRODUCT_NAME + " version " + VERSION);
                return 0;
            } else if ("-dense".equals(s)) {
                dense = true;
            } else if ("-dirty".equals(s)) {
                dirty = true;
            } else if ("-status".equals(s)) {
                status = true;
            } else if ("-log".equals(s)) {
                LOG = true;
            } else if ("-p".equals(s)) {
                String v = argument(args, ++i, s);
                try {
                    precision = Integer.parseInt(v);
                } catch (NumberFormatException e) {
                    throw new HllException(ErrorCode.INVALID_PRECISION, v);
                }
            } else if ("-max-explicit".equals(s)) {
                String v = argument(args, ++i, s);
                try {
                    maxExplicit = Integer.parseInt(v);
                } catch (NumberFormatException e) {
                    throw new HllException(ErrorCode.INVALID_OPTION, s + " " + v);
                }
            } else if ("-format".equals(s)) {
                format = argument(args, ++i, s);
            } else if ("-config".equals(s)) {
                config = argument(args, ++i, s);
            } else if ("-f".equals(s)) {
                file = argument(args, ++i, s);
            } else {
                throw new HllException(ErrorCode.INVALID_OPTION, s);
            }
        }

        if (!"hex".equals(format) && !"raw".equals(format) && !"json".equals(format)) {
            throw new HllException(ErrorCode.INVALID_OPTION, "-format " + format);
        }
        if (precision < HyperLogLogPP.MIN_PRECISION || precision > HyperLogLogPP.MAX_PRECISION) {
            throw new HllException(ErrorCode.INVALID_PRECISION, precision);
        }

        final Options options = config != null ? Options.fromFile(IO.path(config)) : Options.load();
        if (dense != null) options.alwaysWriteDense(dense);
        if (dirty != null) options.writeDirtyEncoding(dirty);
        if (maxExplicit != null) {
            try {
                options.maxExplicitRegisters(maxExplicit);
            } catch (IllegalArgumentException e) {
                throw new HllException(ErrorCode.INVALID_OPTION, e.getMessage());
            }
        }
        if (!LOG) {
            options.logger(new Logger.NullLogger());
        }

        final IO.StopWatch watch = new IO.StopWatch();
        final HyperLogLogPP hll = new HyperLogLogPP(precision);
        final long lines;
        if (file != null) {
            try (InputStream fin = new FileInputStream(IO.path(file))) {
                lines = IO.lines(fin, hll::add);
            }
        } else {
            lines = IO.lines(in, hll::add);
        }

        final Encoded e = PipelineHLL.convert(hll, options);
        switch (format) {
        case "raw":
            PipelineHLL.writeFully(ByteSink.of(out), e.toByteArray(), options.logger());
            out.flush();
            break;
        case "json":
            out.println(Json.toJson(e, true));
            break;
        default:
            out.println(e.toHexString());
            break;
        }

        if (status) {
            System.err.println(lines + " values, " + e.encoding() + ", " + e.size() + " bytes, " 
                + IO.StopWatch.humanReadableTime(watch.elapsed()));
        }
        return 0;
    }

    private static String argument(String[] args, int i, String option) {
        if (i < args.length) {
            return args[i];
        }
        throw new IllegalArgumentException(option + " requires an argument");
    }

    private static void usage(PrintStream out) {
        String CMD = "./bin/" + Options.PRODUCT_NAME_LC;

        out.println("Usage: \"" + CMD + "\" [options]\n");
        out.println(" options:");
        out.println(" \t-f <file>          \tread values from file (one per line, default stdin)");
        out.println(" \t-p <precision>     \tprecision 4..18 (default 14)");
        out.println(" \t-dense             \talways write dense");
        out.println(" \t-dirty             \twrite dirty encoding tags");
        out.println(" \t-max-explicit <n>  \texplicit register limit (default " + Options.DEFAULT_MAX_EXPLICIT_REGISTERS + ")");
        out.println(" \t-config <file>     \tload options from a properties file");
        out.println(" \t-format <fmt>      \thex|raw|json (default hex)");
        out.println(" \t-status            \tprint the executed status");
        out.println(" \t-log               \tenable detailed logging");
        out.println(" \t-version           \tshow version information");
        out.println(" \t-help              \tshow this help\n");
        out.println(" examples:");
        out.println("\tcut -f1 temp/users.tsv | " + CMD + " -p 14 -format json");
        out.println("\t" + CMD + " -f temp/ids.txt -dense -dirty");
    }
}

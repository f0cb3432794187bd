package fr.lapetina.rpcpool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.rpcpool.domain.model.ExecutionResult;
import fr.lapetina.rpcpool.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

/**
 * Command-line entry point: executes one call and prints the result as JSON.
 *
 * <pre>
 * rpc-pool &lt;config.yaml&gt; &lt;method&gt; [params-json-array]
 * </pre>
 *
 * Exit codes: 0 on success, 1 when every endpoint failed, 2 on usage or configuration errors.
 */
public class RpcPoolApplication {

    private static final Logger log = LoggerFactory.getLogger(RpcPoolApplication.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Runs one call.
     *
     * @return process exit code
     */
    int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 2 || args.length > 3) {
            err.println("Usage: rpc-pool <config.yaml> <method> [params-json-array]");
            return EXIT_USAGE;
        }

        String configPath = args[0];
        String method = args[1];

        List<Object> params;
        try {
            params = args.length == 3
                    ? objectMapper.readValue(args[2], new TypeReference<List<Object>>() { })
                    : List.of();
        } catch (JsonProcessingException e) {
            err.println("Params must be a JSON array: " + e.getOriginalMessage());
            return EXIT_USAGE;
        }

        try (NetworkClientFactory factory = NetworkClientFactory.create(configPath)) {
            ExecutionResult<Object> result = factory.getClient().execute(method, params);
            out.println(objectMapper.writeValueAsString(result));
            return result.success() ? EXIT_SUCCESS : EXIT_FAILURE;
        } catch (ConfigurationException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (JsonProcessingException e) {
            log.error("Failed to render result: method={}", method, e);
            return EXIT_FAILURE;
        }
    }

    public static void main(String[] args) {
        int exitCode = new RpcPoolApplication().run(args, System.out, System.err);
        System.exit(exitCode);
    }
}

package ai.pipestream.history;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Main application entry point for the Document History Service.
 * Records document versions, compares them and rolls documents back.
 */
@QuarkusMain
@ApplicationScoped
public class DocumentHistoryApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(DocumentHistoryApplication.class);

    public static void main(String... args) {
        Quarkus.run(DocumentHistoryApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.info("Document History Service started successfully");
        Quarkus.waitForExit();
        return 0;
    }
}

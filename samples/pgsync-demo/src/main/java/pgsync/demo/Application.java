package pgsync.demo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command-line sync tool built on the Spring Boot starter.
 *
 * <p>Run with: mvn install -DskipTests && java -jar samples/pgsync-demo/target/pgsync-demo-*.jar &lt;command&gt;
 *
 * <p>Commands:
 * setup [--recreate] [--backfill-queue] [--tables=a,b]  - install queue and triggers, create collections
 * sync [--batch-size=N] [--tables=a,b]                  - drain the change queue into Typesense
 * status [--tables=a,b]                                 - queue statistics and per-table counts
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(Application.class, args)));
    }
}

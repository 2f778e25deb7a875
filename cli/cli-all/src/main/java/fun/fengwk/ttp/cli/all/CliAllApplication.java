package fun.fengwk.ttp.cli.all;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */

@SpringBootApplication(scanBasePackages = "fun.fengwk.ttp")
public class CliAllApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CliAllApplication.class, args)));
    }

}

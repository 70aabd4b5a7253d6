package com.purchasingpower.issueflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class IssueFlowApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(IssueFlowApplication.class);
        if (IssueCommandRunner.isCommandLineRun(args)) {
            application.setWebApplicationType(WebApplicationType.NONE);
            System.exit(SpringApplication.exit(application.run(args)));
        }
        application.run(args);
    }
}

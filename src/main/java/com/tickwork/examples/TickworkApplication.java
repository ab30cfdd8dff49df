package com.tickwork.examples;

import com.tickwork.admin.AdminServer;
import com.tickwork.admin.JobAdminService;
import com.tickwork.core.JobFunctionRegistry;
import com.tickwork.core.Slf4jJobResultListener;
import com.tickwork.core.TaskManager;
import com.tickwork.core.TaskManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Runs a scheduler with the sample functions and the admin server until the JVM is stopped.
 * Configuration is read by {@link TaskManagerFactory}.
 */
public class TickworkApplication {
    private static final Logger log = LoggerFactory.getLogger(TickworkApplication.class);

    public static void main(String[] args) throws Exception {
        TaskManagerFactory factory = new TaskManagerFactory();
        JobFunctionRegistry registry = new JobFunctionRegistry();
        SampleFunctions.registerAll(registry);

        TaskManager manager = factory.create(registry);
        manager.addResultListener(new Slf4jJobResultListener());
        manager.start();

        AdminServer admin = null;
        int port = factory.getAdminPort();
        if (port >= 0) {
            admin = new AdminServer(new JobAdminService(manager));
            admin.start(port);
        }

        CountDownLatch stopped = new CountDownLatch(1);
        AdminServer adminServer = admin;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            if (adminServer != null) {
                adminServer.stop();
            }
            manager.stop();
            factory.close();
            stopped.countDown();
        }, "tickwork-shutdown"));
        stopped.await();
    }
}

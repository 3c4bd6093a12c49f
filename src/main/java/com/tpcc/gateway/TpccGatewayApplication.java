package com.tpcc.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TPC-C order-processing gateway.
 *
 * Serves the five TPC-C transaction protocols, order/payment/inventory
 * reporting and an ACID conformance harness over one of two backends:
 * - a PostgreSQL-compatible database through JDBC
 * - Google Cloud Spanner through its native client
 *
 * @version 1.0.0
 */
@SpringBootApplication
public class TpccGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(TpccGatewayApplication.class, args);
    }
}

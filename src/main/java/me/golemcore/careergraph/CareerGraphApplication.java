package me.golemcore.careergraph;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for CareerGraph.
 *
 * <p>
 * CareerGraph matches candidates to job postings by combining skill overlap in
 * a typed knowledge graph (jobs, skills, companies, candidates) with semantic
 * similarity of node embeddings. Nodes are added online with approximate
 * embeddings and the whole graph is rebuilt nightly from the canonical job
 * dataset with structural embeddings.
 */
@SpringBootApplication
public class CareerGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(CareerGraphApplication.class, args);
    }
}

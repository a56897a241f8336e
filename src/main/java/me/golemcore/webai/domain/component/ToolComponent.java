package me.golemcore.webai.domain.component;

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

import me.golemcore.webai.domain.model.ToolDescriptor;
import me.golemcore.webai.domain.model.ToolInput;
import me.golemcore.webai.domain.model.ToolOutput;

import java.util.concurrent.CompletableFuture;

/**
 * A tool that augments the prompt with auxiliary text and citations before the
 * answer is generated. Examples are the web search and arithmetic tools.
 *
 * <p>
 * A tool may be abandoned after its timeout while still running, so a late
 * completion must have no observable side effect.
 */
public interface ToolComponent extends Component {

    /**
     * Returns the static descriptor of this tool.
     *
     * @return the tool descriptor
     */
    ToolDescriptor getDescriptor();

    /**
     * Runs the tool for one request. Failures are reported by completing the
     * future exceptionally (or by throwing directly).
     *
     * @param input
     *            prompt, condensed history and token budget of the request
     * @return a future containing the tool output
     */
    CompletableFuture<ToolOutput> run(ToolInput input);

    /**
     * Returns the unique id of this tool.
     *
     * @return the tool id
     */
    default String getToolId() {
        return getDescriptor().getId();
    }
}

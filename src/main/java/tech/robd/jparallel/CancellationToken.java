/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/CancellationToken.java
 description: Cancellation token interface carrying a reason, with callbacks and parent/child propagation.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 tags: [robokeytags,v1]
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 * Licensed under the Apache License, Version 2.0 (the "License");
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package tech.robd.jparallel;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.function.Consumer;

/**
 * Cancellation signal carrying the reason it was cancelled with.
 * <p>Tokens form a tree: cancelling a parent cancels every child with the same reason,
 * children can be cancelled on their own.</p>
 */
public interface CancellationToken {

    /**
     * @return {@code true} once cancelled
     */
    boolean isCancelled();

    /**
     * @return the reason given to {@link #cancel(Throwable)}, {@code null} while not cancelled
     */
    @Nullable Throwable reason();

    /**
     * Register a callback receiving the cancellation reason. Runs immediately on the calling
     * thread if the token is already cancelled.
     *
     * @return handle removing the callback when closed
     */
    @NonNull AutoCloseable onCancel(@NonNull Consumer<Throwable> callback);

    /**
     * @return a token cancelled together with this one
     */
    @NonNull CancellationToken child();

    /**
     * Cancel this token and its children.
     *
     * @return {@code true} if this call performed the cancellation
     */
    boolean cancel(@NonNull Throwable reason);
}

/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/protocol/MessageVisitor.java
 description: Visitor over protocol message types.
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
package tech.robd.jparallel.protocol;

/**
 * Exhaustive handler over {@link ProtocolMessage}.
 *
 * @param <R> result type
 */
public interface MessageVisitor<R> {

    R visitReady(Ready message);

    R visitCall(CallMessage message);

    R visitGeneratorRequest(GeneratorRequest message);

    R visitReturn(ReturnMessage message);

    R visitYield(YieldMessage message);

    R visitError(ErrorMessage message);

    R visitGeneratorAck(GeneratorAck message);

    R visitChannel(ChannelMessage message);
}

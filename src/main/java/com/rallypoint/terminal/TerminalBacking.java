/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rallypoint.terminal;

import org.jspecify.annotations.NonNull;

import static java.util.Objects.requireNonNull;

/**
 * What a terminal session runs on.  Decided once at creation and never changed.
 */
sealed interface TerminalBacking permits TerminalBacking.PtyBacking, TerminalBacking.SimulatedBacking {
	record PtyBacking(@NonNull PseudoTerminal pseudoTerminal) implements TerminalBacking {
		public PtyBacking {
			requireNonNull(pseudoTerminal);
		}
	}

	record SimulatedBacking(@NonNull SimulatedShell simulatedShell) implements TerminalBacking {
		public SimulatedBacking {
			requireNonNull(simulatedShell);
		}
	}
}

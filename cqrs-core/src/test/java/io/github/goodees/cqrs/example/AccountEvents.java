package io.github.goodees.cqrs.example;

/*-
 * #%L
 * cqrs
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.cqrs.eventing.Event;

public final class AccountEvents {
    private AccountEvents() {
    }

    public static class Opened implements Event {
        private String owner;

        private Opened() {
        }

        public Opened(String owner) {
            this.owner = owner;
        }

        public String getOwner() {
            return owner;
        }
    }

    public static class Deposited implements Event {
        private long amount;

        private Deposited() {
        }

        public Deposited(long amount) {
            this.amount = amount;
        }

        public long getAmount() {
            return amount;
        }

        @Override
        public String toString() {
            return "Deposited[" + amount + "]";
        }
    }

    public static class Withdrawn implements Event {
        private long amount;

        private Withdrawn() {
        }

        public Withdrawn(long amount) {
            this.amount = amount;
        }

        public long getAmount() {
            return amount;
        }
    }

    public static class TransferInitiated implements Event {
        private String transferId;
        private String source;
        private String target;
        private long amount;

        private TransferInitiated() {
        }

        public TransferInitiated(String transferId, String source, String target, long amount) {
            this.transferId = transferId;
            this.source = source;
            this.target = target;
            this.amount = amount;
        }

        public String getTransferId() {
            return transferId;
        }

        public String getSource() {
            return source;
        }

        public String getTarget() {
            return target;
        }

        public long getAmount() {
            return amount;
        }
    }

    public static class TransferReceived implements Event {
        private String transferId;

        private TransferReceived() {
        }

        public TransferReceived(String transferId) {
            this.transferId = transferId;
        }

        public String getTransferId() {
            return transferId;
        }
    }
}

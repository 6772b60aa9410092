package com.sommerph.musigbackend.service.signing;

import com.sommerph.musigbackend.exception.AuthorizationException;
import com.sommerph.musigbackend.exception.WalletErrorCode;
import com.sommerph.musigbackend.model.transaction.DesiredOutput;
import com.sommerph.musigbackend.model.transaction.PartialSignature;
import com.sommerph.musigbackend.model.transaction.TransactionDraft;
import com.sommerph.musigbackend.model.wallet.BitcoinNetwork;
import com.sommerph.musigbackend.model.wallet.MultisigWallet;
import com.sommerph.musigbackend.service.transaction.TransactionAssemblyService;
import com.sommerph.musigbackend.util.SignatureUtils;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.sommerph.musigbackend.support.WalletFixtures.TESTNET_DESTINATION;
import static com.sommerph.musigbackend.support.WalletFixtures.key;
import static com.sommerph.musigbackend.support.WalletFixtures.keys;
import static com.sommerph.musigbackend.support.WalletFixtures.legacyUtxo;
import static com.sommerph.musigbackend.support.WalletFixtures.wallet;
import static com.sommerph.musigbackend.support.WalletFixtures.witnessUtxo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

@DisplayName("SigningCoordinator")
class SigningCoordinatorTest {

    private final TransactionAssemblyService assemblyService = new TransactionAssemblyService();
    private SigningCoordinator coordinator;
    private List<ECKey> signers;
    private MultisigWallet wallet;

    @BeforeEach
    void setUp() {
        coordinator = new SigningCoordinator();
        signers = keys(11, 22, 33);
        wallet = wallet("treasury", 2, signers, BitcoinNetwork.TESTNET);
    }

    private TransactionDraft witnessDraft() {
        return assemblyService.assemble(wallet, List.of(witnessUtxo(wallet, 100_000)),
                List.of(new DesiredOutput(TESTNET_DESTINATION, 50_000)), 1_000);
    }

    @Nested
    @DisplayName("Accepted signatures")
    class Accepted {

        @Test
        @DisplayName("Should record a SIGHASH_ALL signature that verifies against the witness digest")
        void shouldRecordWitnessSignature() {
            TransactionDraft draft = witnessDraft();

            boolean signed = coordinator.submitSignature(wallet, draft, signers.get(0), 0);

            assertThat(signed).isTrue();
            List<PartialSignature> recorded = draft.getPartialSignatures(0);
            assertThat(recorded).hasSize(1);
            assertThat(recorded.get(0).getPublicKey()).isEqualTo(signers.get(0).getPubKey());
            byte[] signature = recorded.get(0).getSignature();
            assertThat(SignatureUtils.sigHashFlag(signature)).isEqualTo(Transaction.SigHash.ALL.value);
            assertThat(SignatureUtils.verify(draft.signingDigest(0, wallet.getRedeemScript()), signature,
                    signers.get(0).getPubKey())).isTrue();
            assertThat(wallet.getSession().hasSigned(signers.get(0).getPubKey())).isTrue();
        }

        @Test
        @DisplayName("Should sign legacy inputs with the legacy digest")
        void shouldRecordLegacySignature() {
            TransactionDraft draft = assemblyService.assemble(wallet, List.of(legacyUtxo(wallet, 100_000)),
                    List.of(new DesiredOutput(TESTNET_DESTINATION, 50_000)), 1_000);

            assertThat(coordinator.submitSignature(wallet, draft, signers.get(1), 0)).isTrue();

            byte[] signature = draft.getPartialSignatures(0).get(0).getSignature();
            assertThat(SignatureUtils.verify(draft.signingDigest(0, wallet.getRedeemScript()), signature,
                    signers.get(1).getPubKey())).isTrue();
        }

    }

    @Nested
    @DisplayName("Rejected signatures")
    class Rejected {

        @Test
        @DisplayName("Should reject a signer outside the key set")
        void shouldRejectUnauthorizedSigner() {
            TransactionDraft draft = witnessDraft();

            assertThatThrownBy(() -> coordinator.submitSignature(wallet, draft, key(99), 0))
                    .isInstanceOf(AuthorizationException.class)
                    .hasMessage("Signer is not part of the multisig setup")
                    .extracting("errorCode")
                    .isEqualTo(WalletErrorCode.UNAUTHORIZED_SIGNER);
            assertThat(draft.getSignatureCount()).isZero();
        }

        @Test
        @DisplayName("Should reject the same signer twice on one draft")
        void shouldRejectDuplicateOnSameDraft() {
            TransactionDraft draft = witnessDraft();
            coordinator.submitSignature(wallet, draft, signers.get(0), 0);

            assertThatThrownBy(() -> coordinator.submitSignature(wallet, draft, signers.get(0), 0))
                    .isInstanceOf(AuthorizationException.class)
                    .hasMessage("This key has already signed")
                    .extracting("errorCode")
                    .isEqualTo(WalletErrorCode.DUPLICATE_SIGNATURE);
            assertThat(draft.getSignatureCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should reject a signer who already signed another draft of the wallet")
        void shouldRejectDuplicateAcrossDrafts() {
            coordinator.submitSignature(wallet, witnessDraft(), signers.get(0), 0);
            TransactionDraft second = witnessDraft();

            assertThatThrownBy(() -> coordinator.submitSignature(wallet, second, signers.get(0), 0))
                    .isInstanceOf(AuthorizationException.class)
                    .extracting("errorCode")
                    .isEqualTo(WalletErrorCode.DUPLICATE_SIGNATURE);
            assertThat(second.getSignatureCount()).isZero();
        }

        @Test
        @DisplayName("Should refuse to sign a finalized draft")
        void shouldRejectFinalizedDraft() {
            TransactionDraft draft = witnessDraft();
            draft.markFinalized("00");

            assertThatThrownBy(() -> coordinator.submitSignature(wallet, draft, signers.get(0), 0))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(wallet.getSession().hasSigned(signers.get(0).getPubKey())).isFalse();
        }

        @Test
        @DisplayName("Should raise when the draft is finalized while the signature is being added")
        void shouldRaiseWhenFinalizedDuringSigning() {
            TransactionDraft finalized = witnessDraft();
            finalized.markFinalized("00");
            TransactionDraft draft = spy(finalized);
            // Passes the early check, then meets the finalized state inside the session monitor
            doReturn(false).when(draft).isFinalized();

            assertThatThrownBy(() -> coordinator.submitSignature(wallet, draft, signers.get(0), 0))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("Transaction is already finalized");
            assertThat(wallet.getSession().hasSigned(signers.get(0).getPubKey())).isFalse();
        }

        @Test
        @DisplayName("Should report a signing failure as false and leave session and draft unchanged")
        void shouldReturnFalseOnBadInputIndex() {
            TransactionDraft draft = witnessDraft();

            boolean signed = coordinator.submitSignature(wallet, draft, signers.get(0), 5);

            assertThat(signed).isFalse();
            assertThat(draft.getSignatureCount()).isZero();
            assertThat(wallet.getSession().hasSigned(signers.get(0).getPubKey())).isFalse();
        }

        @Test
        @DisplayName("Should let only one of several concurrent submissions by the same signer succeed")
        void shouldSerializeConcurrentSubmissions() throws Exception {
            TransactionDraft draft = witnessDraft();
            ECKey signer = signers.get(2);
            int attempts = 8;
            ExecutorService executor = Executors.newFixedThreadPool(attempts);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Boolean>> results = new ArrayList<>();
                for (int i = 0; i < attempts; i++) {
                    Callable<Boolean> attempt = () -> {
                        start.await();
                        try {
                            return coordinator.submitSignature(wallet, draft, signer, 0);
                        } catch (AuthorizationException e) {
                            return false;
                        }
                    };
                    results.add(executor.submit(attempt));
                }
                start.countDown();

                int successes = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(30, TimeUnit.SECONDS)) {
                        successes++;
                    }
                }
                assertThat(successes).isEqualTo(1);
                assertThat(draft.getSignatureCount()).isEqualTo(1);
            } finally {
                executor.shutdownNow();
            }
        }

    }

    @Nested
    @DisplayName("resetSession")
    class ResetSession {

        @Test
        @DisplayName("Should let a signer sign again after a reset while keeping recorded signatures")
        void shouldAllowSigningAfterReset() {
            TransactionDraft first = witnessDraft();
            coordinator.submitSignature(wallet, first, signers.get(0), 0);

            coordinator.resetSession(wallet);
            TransactionDraft second = witnessDraft();

            assertThat(coordinator.submitSignature(wallet, second, signers.get(0), 0)).isTrue();
            assertThat(first.getSignatureCount()).isEqualTo(1);
            assertThat(second.getSignatureCount()).isEqualTo(1);
        }

    }

}

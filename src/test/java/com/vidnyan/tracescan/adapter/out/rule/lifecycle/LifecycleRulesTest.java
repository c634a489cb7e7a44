package com.vidnyan.tracescan.adapter.out.rule.lifecycle;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.RuleMatch;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LifecycleRulesTest {

    private static SourceFile profileFragment(String guardLine) {
        return SourceFile.of("ProfileFragment.java",
                "public class ProfileFragment extends Fragment {",
                "    void load() {",
                "        api.fetch(new Callback<User>() {",
                "            @Override",
                "            public void onResponse(User user) {",
                "                " + guardLine,
                "                Toast.makeText(requireContext(), \"ok\", Toast.LENGTH_SHORT).show();",
                "            }",
                "        });",
                "    }",
                "    void render() {",
                "        title.setText(requireContext().getString(R.string.title));",
                "    }",
                "}");
    }

    @Test
    void detachedFragment_ShouldFlagHostAccessInsideAsyncCallback() {
        // Arrange
        SourceFile file = profileFragment("log(user);");

        // Act
        List<RuleMatch> matches = new DetachedFragmentRule().analyze(file);

        // Assert
        assertEquals(1, matches.size());
        assertEquals(7, matches.get(0).lineNumber());
        assertEquals(Severity.HIGH, matches.get(0).severity());
        assertEquals("requireContext() inside Callback callback (line 3) can run after the fragment is detached",
                matches.get(0).detail());
    }

    @Test
    void detachedFragment_ShouldAcceptIsAddedGuard() {
        assertTrue(new DetachedFragmentRule().analyze(profileFragment("if (!isAdded()) return;")).isEmpty());
    }

    @Test
    void commitAfterStateSaved_ShouldFlagCommitInOnStop() {
        SourceFile file = SourceFile.of("Host.java",
                "class Host extends AppCompatActivity {",
                "    @Override",
                "    protected void onStop() {",
                "        super.onStop();",
                "        getSupportFragmentManager().beginTransaction()",
                "                .replace(R.id.root, new EmptyFragment())",
                "                .commit();",
                "    }",
                "    protected void onResume() {",
                "        getSupportFragmentManager().beginTransaction().add(f, \"t\").commit();",
                "    }",
                "}");

        List<RuleMatch> matches = new CommitAfterStateSavedRule().analyze(file);

        assertEquals(1, matches.size());
        assertEquals(7, matches.get(0).lineNumber());
        assertEquals("Fragment transaction committed in onStop()", matches.get(0).detail());
    }

    @Test
    void dialogLeak_ShouldFlagDialogShownFromDelayedCallback() {
        SourceFile file = SourceFile.of("MainActivity.kt",
                "class MainActivity : AppCompatActivity() {",
                "    fun confirm() {",
                "        handler.postDelayed({",
                "            AlertDialog.Builder(this).setMessage(\"Done\").create().show()",
                "        }, 500)",
                "    }",
                "    fun direct() {",
                "        dialog.show()",
                "    }",
                "}");

        List<RuleMatch> matches = new DialogLeakRule().analyze(file);

        assertEquals(1, matches.size());
        assertEquals(4, matches.get(0).lineNumber());
        assertEquals(Severity.MEDIUM, matches.get(0).severity());
        assertEquals("Dialog shown from postDelayed callback without a window state check", matches.get(0).detail());
    }

    @Test
    void dialogLeak_ShouldAcceptFinishingCheck() {
        SourceFile file = SourceFile.of("MainActivity.kt",
                "fun confirm() {",
                "    handler.postDelayed({",
                "        if (!isFinishing) {",
                "            dialog.show()",
                "        }",
                "    }, 500)",
                "}");

        assertTrue(new DialogLeakRule().analyze(file).isEmpty());
    }

    @Test
    void lateinitTeardown_ShouldFlagFirstUncheckedRead() {
        SourceFile file = SourceFile.of("PlayerFragment.kt",
                "class PlayerFragment : Fragment() {",
                "    private lateinit var player: ExoPlayer",
                "    private lateinit var adapter: ItemAdapter",
                "    override fun onDestroyView() {",
                "        super.onDestroyView()",
                "        player.release()",
                "        if (::adapter.isInitialized) adapter.clear()",
                "    }",
                "    override fun onStop() = player.stop()",
                "}");

        List<RuleMatch> matches = new LateinitTeardownRule().analyze(file);

        assertEquals(2, matches.size());
        assertEquals(6, matches.get(0).lineNumber());
        assertEquals("lateinit 'player' read in onDestroyView() without ::player.isInitialized",
                matches.get(0).detail());
        assertEquals(9, matches.get(1).lineNumber());
    }

    @Test
    void receiverUnregister_ShouldFlagUnguardedUnregister() {
        SourceFile file = SourceFile.of("MainActivity.java",
                "protected void onResume() {",
                "    registerReceiver(receiver, filter);",
                "}",
                "protected void onPause() {",
                "    unregisterReceiver(receiver);",
                "}");

        List<RuleMatch> matches = new ReceiverUnregisterRule().analyze(file);

        assertEquals(1, matches.size());
        assertEquals(5, matches.get(0).lineNumber());
        assertEquals(Severity.MEDIUM, matches.get(0).severity());
    }

    @Test
    void receiverUnregister_ShouldFlagMissingUnregisterAndAcceptFlag() {
        SourceFile missing = SourceFile.of("Tracker.java",
                "void start() {",
                "    registerReceiver(receiver, filter);",
                "}");
        SourceFile guarded = SourceFile.of("Tracker.kt",
                "fun stop() {",
                "    if (isReceiverRegistered) {",
                "        unregisterReceiver(receiver)",
                "    }",
                "}");

        List<RuleMatch> matches = new ReceiverUnregisterRule().analyze(missing);

        assertEquals(1, matches.size());
        assertEquals(2, matches.get(0).lineNumber());
        assertEquals(Severity.LOW, matches.get(0).severity());
        assertTrue(new ReceiverUnregisterRule().analyze(guarded).isEmpty());
    }
}

package work.cellium.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.cellium.kernel.api.LoadPolicy;
import work.cellium.kernel.bus.EventBus;
import work.cellium.kernel.demo.GreeterCell;
import work.cellium.kernel.error.CellLoadException;
import work.cellium.kernel.error.CircularDependencyException;
import work.cellium.kernel.error.DuplicateCellException;
import work.cellium.kernel.error.ErrorKind;
import work.cellium.kernel.error.KernelException;
import work.cellium.kernel.process.ProcessManager;
import work.cellium.kernel.support.KernelTestSupport;
import work.cellium.kernel.support.KernelTestSupport.CycleA;
import work.cellium.kernel.support.KernelTestSupport.CycleB;
import work.cellium.kernel.support.KernelTestSupport.DependentCell;
import work.cellium.kernel.support.KernelTestSupport.EchoCell;
import work.cellium.kernel.support.KernelTestSupport.ListenerCell;

class CellLoaderTest {
    private EventBus eventBus;
    private Registry registry;
    private Injector injector;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        registry = new Registry();
        injector = new Injector(eventBus, ProcessManager.builder().workers(0).build(), registry);
        KernelTestSupport.CLOSED.clear();
    }

    private CellLoader loader(LoadPolicy policy) {
        return new CellLoader(registry, injector, eventBus, policy);
    }

    @Test
    void loadsConfiguredCellsInOrder() {
        var names = loader(LoadPolicy.STRICT).load(List.of(GreeterCell.class.getName(), EchoCell.class.getName()));
        assertEquals(List.of("greeter", "echo"), names);
        assertEquals(List.of("greeter", "echo"), registry.names());
    }

    @Test
    void dependencyIsLoadedFirstEvenWhenConfiguredLater() {
        var names = loader(LoadPolicy.STRICT).load(List.of(DependentCell.class.getName(), EchoCell.class.getName()));

        assertEquals(List.of("echo", "dependent"), names);
        var dependent = (DependentCell) registry.resolve("dependent");
        assertSame(registry.resolve("echo"), dependent.echo());
    }

    @Test
    void cycleFailsWithCircularDependency() {
        var ex = assertThrows(CellLoadException.class,
            () -> loader(LoadPolicy.STRICT).load(List.of(CycleA.class.getName(), CycleB.class.getName())));

        var cycle = assertInstanceOf(CircularDependencyException.class, ex.getCause());
        assertEquals(ErrorKind.CIRCULAR_DEPENDENCY, cycle.kind());
        assertEquals(List.of(CycleA.class.getName(), CycleB.class.getName(), CycleA.class.getName()), cycle.chain());
        assertTrue(registry.names().isEmpty());
    }

    @Test
    void lenientPolicySkipsFailuresAndLoadsTheRest() {
        var loader = loader(LoadPolicy.LENIENT);
        var names = loader.load(List.of(
            "work.cellium.kernel.demo.DoesNotExist",
            KernelTestSupport.BrokenCell.class.getName(),
            GreeterCell.class.getName(),
            CycleA.class.getName(),
            CycleB.class.getName()
        ));

        assertEquals(List.of("greeter"), names);
        assertEquals(List.of(
            "work.cellium.kernel.demo.DoesNotExist",
            KernelTestSupport.BrokenCell.class.getName(),
            CycleA.class.getName(),
            CycleB.class.getName()
        ), loader.skipped());
    }

    @Test
    void strictPolicyTearsDownWhatWasLoaded() {
        var ex = assertThrows(CellLoadException.class, () -> loader(LoadPolicy.STRICT).load(List.of(
            ListenerCell.class.getName(),
            KernelTestSupport.BrokenCell.class.getName()
        )));

        assertEquals(KernelTestSupport.BrokenCell.class.getName(), ex.identifier());
        assertEquals(ErrorKind.CELL_LOAD_FAILURE, ex.kind());
        assertTrue(registry.names().isEmpty());
        assertEquals(List.of("listener"), KernelTestSupport.CLOSED);
        assertEquals(0, eventBus.subscriberCount("ping"));
    }

    @Test
    void sameCellConfiguredTwiceIsADuplicate() {
        var loader = loader(LoadPolicy.LENIENT);
        loader.load(List.of(GreeterCell.class.getName(), GreeterCell.class.getName()));
        assertEquals(List.of("greeter"), registry.names());
        assertEquals(List.of(GreeterCell.class.getName()), loader.skipped());

        var strict = new CellLoader(new Registry(), injector, eventBus, LoadPolicy.STRICT);
        var ex = assertThrows(CellLoadException.class,
            () -> strict.load(List.of(GreeterCell.class.getName(), GreeterCell.class.getName())));
        assertInstanceOf(DuplicateCellException.class, ex.getCause());
    }

    @Test
    void nonCellClassIsRejected() {
        var ex = assertThrows(CellLoadException.class, () -> loader(LoadPolicy.STRICT).load(List.of(String.class.getName())));
        assertEquals(ErrorKind.CELL_LOAD_FAILURE, assertInstanceOf(KernelException.class, ex.getCause()).kind());
    }

    @Test
    void eventHandlersAreSubscribedUnderTheCellName() {
        loader(LoadPolicy.STRICT).load(List.of(ListenerCell.class.getName()));
        var listener = (ListenerCell) registry.resolve("listener");

        eventBus.publish("ping", Map.of("n", 1));

        assertEquals(List.of("ping:1"), listener.received());
        assertEquals(1, eventBus.unsubscribeAll("listener"));
    }

    @Test
    void unloadRunsInReverseOrderAndRemovesSubscriptions() {
        var loader = loader(LoadPolicy.STRICT);
        loader.load(List.of(
            KernelTestSupport.FirstClosingCell.class.getName(),
            ListenerCell.class.getName(),
            KernelTestSupport.SecondClosingCell.class.getName()
        ));
        var listener = (ListenerCell) registry.resolve("listener");

        loader.unload();

        assertEquals(List.of("second", "listener", "first"), KernelTestSupport.CLOSED);
        assertTrue(registry.names().isEmpty());
        eventBus.publish("ping", Map.of("n", 2));
        assertTrue(listener.received().isEmpty());
        assertEquals(List.of(), loader.loadedNames());
    }
}
